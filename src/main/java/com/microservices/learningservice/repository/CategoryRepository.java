package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CategoryRepository extends JpaRepository<Category, Long> {
    List<Category> findByActiveTrueOrderByTitle();
    boolean existsByTitleIgnoreCase(String title);

    /**
     * Rows of [categoryId, publishedCourseCount].
     */
    @Query("select c.id, count(co) from Course co join co.categories c where co.published = true group by c.id")
    List<Object[]> countPublishedCoursesPerCategory();
}
