package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.CourseReview;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface CourseReviewRepository extends JpaRepository<CourseReview, Long> {
    boolean existsByCourseIdAndStudentId(Long courseId, Long studentId);
    Page<CourseReview> findByCourseIdAndPublishedTrueOrderByCreatedAtDesc(Long courseId, Pageable pageable);
    long countByCourseIdAndPublishedTrue(Long courseId);

    @Query("select r.rating from CourseReview r where r.course.id = :courseId and r.published = true")
    List<Integer> findPublishedRatings(@Param("courseId") Long courseId);

    /**
     * Rows of [courseId, rating] for every published review of the given courses.
     */
    @Query("select r.course.id, r.rating from CourseReview r " +
           "where r.published = true and r.course.id in :courseIds")
    List<Object[]> findPublishedRatingsByCourseIds(@Param("courseIds") Collection<Long> courseIds);
}
