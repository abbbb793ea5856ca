package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.Lesson;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LessonRepository extends JpaRepository<Lesson, Long> {
    List<Lesson> findByModuleIdOrderByOrderNumber(Long moduleId);
    boolean existsByModuleIdAndOrderNumber(Long moduleId, Integer orderNumber);

    @Query("select max(l.orderNumber) from Lesson l where l.module.id = :moduleId")
    Integer findMaxOrderNumber(@Param("moduleId") Long moduleId);

    @Query("select count(l) from Lesson l where l.module.course.id = :courseId")
    long countByCourseId(@Param("courseId") Long courseId);
}
