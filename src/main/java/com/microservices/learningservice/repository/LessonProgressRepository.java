package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.LessonProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LessonProgressRepository extends JpaRepository<LessonProgress, Long> {
    Optional<LessonProgress> findByStudentIdAndLessonId(Long studentId, Long lessonId);

    @Query("select count(p) from LessonProgress p " +
           "where p.student.id = :studentId and p.lesson.module.course.id = :courseId and p.completed = true")
    long countCompletedInCourse(@Param("studentId") Long studentId, @Param("courseId") Long courseId);

    @Query("select p from LessonProgress p " +
           "where p.student.id = :studentId and p.lesson.module.course.id = :courseId " +
           "order by p.lesson.module.orderNumber, p.lesson.orderNumber")
    List<LessonProgress> findByStudentInCourse(@Param("studentId") Long studentId, @Param("courseId") Long courseId);

    @Query("select p.lesson.id from LessonProgress p " +
           "where p.student.id = :studentId and p.lesson.module.course.id = :courseId and p.completed = true")
    List<Long> findCompletedLessonIds(@Param("studentId") Long studentId, @Param("courseId") Long courseId);
}
