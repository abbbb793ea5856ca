package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.Course;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CourseRepository extends JpaRepository<Course, Long>, JpaSpecificationExecutor<Course> {
    Optional<Course> findBySlug(String slug);
    boolean existsBySlug(String slug);
    Page<Course> findByTeacherIdOrderByCreatedAtDesc(Long teacherId, Pageable pageable);

    @Query("select c from Course c join c.categories cat where cat.id = :categoryId")
    List<Course> findByCategoryId(@Param("categoryId") Long categoryId);
}
