package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.CourseModule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CourseModuleRepository extends JpaRepository<CourseModule, Long> {
    List<CourseModule> findByCourseIdOrderByOrderNumber(Long courseId);
    boolean existsByCourseIdAndOrderNumber(Long courseId, Integer orderNumber);

    @Query("select max(m.orderNumber) from CourseModule m where m.course.id = :courseId")
    Integer findMaxOrderNumber(@Param("courseId") Long courseId);
}
