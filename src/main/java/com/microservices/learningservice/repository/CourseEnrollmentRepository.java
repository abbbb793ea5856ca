package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.CourseEnrollment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CourseEnrollmentRepository extends JpaRepository<CourseEnrollment, Long> {
    Optional<CourseEnrollment> findByStudentIdAndCourseId(Long studentId, Long courseId);
    Optional<CourseEnrollment> findByStudentIdAndCourseIdAndActiveTrue(Long studentId, Long courseId);
    boolean existsByStudentIdAndCourseIdAndActiveTrue(Long studentId, Long courseId);
    long countByCourseIdAndActiveTrue(Long courseId);
    Page<CourseEnrollment> findByStudentIdAndActiveTrueOrderByEnrolledAtDesc(Long studentId, Pageable pageable);

    /**
     * Rows of [courseId, activeEnrollmentCount].
     */
    @Query("select e.course.id, count(e) from CourseEnrollment e " +
           "where e.active = true and e.course.id in :courseIds group by e.course.id")
    List<Object[]> countActiveByCourseIds(@Param("courseIds") Collection<Long> courseIds);

    @Query("select e.course.id from CourseEnrollment e " +
           "where e.active = true and e.student.id = :studentId and e.course.id in :courseIds")
    List<Long> findActiveCourseIds(@Param("studentId") Long studentId, @Param("courseIds") Collection<Long> courseIds);
}
