package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.Category;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseEnrollment;
import com.microservices.learningservice.model.CourseReview;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Catalog filters and the two sort orders that need an aggregate (popularity, rating).
 */
public final class CourseSpecifications {

    private CourseSpecifications() {
    }

    public static Specification<Course> published() {
        return (root, query, cb) -> cb.isTrue(root.get("published"));
    }

    /**
     * Case-insensitive match on title, description or tags.
     */
    public static Specification<Course> matches(String search) {
        return (root, query, cb) -> {
            String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("title")), pattern),
                    cb.like(cb.lower(root.get("description")), pattern),
                    cb.like(cb.lower(root.get("tags")), pattern));
        };
    }

    public static Specification<Course> inCategory(String categoryTitle) {
        return (root, query, cb) -> {
            Subquery<Long> match = query.subquery(Long.class);
            Root<Course> course = match.correlate(root);
            Join<Course, Category> category = course.join("categories");
            match.select(category.get("id"))
                    .where(cb.equal(cb.lower(category.get("title")), categoryTitle.trim().toLowerCase(Locale.ROOT)));
            return cb.exists(match);
        };
    }

    public static Specification<Course> hasLevel(Course.CourseLevel level) {
        return (root, query, cb) -> cb.equal(root.get("level"), level);
    }

    public static Specification<Course> hasLanguage(Course.CourseLanguage language) {
        return (root, query, cb) -> cb.equal(root.get("language"), language);
    }

    public static Specification<Course> isFree(boolean free) {
        return (root, query, cb) -> cb.equal(root.get("free"), free);
    }

    public static Specification<Course> taughtBy(Long teacherId) {
        return (root, query, cb) -> cb.equal(root.get("teacher").get("id"), teacherId);
    }

    /**
     * Orders by active enrollment count, most popular first.
     */
    public static Specification<Course> orderByPopularity() {
        return (root, query, cb) -> {
            if (!isCountQuery(query)) {
                Subquery<Long> enrolled = query.subquery(Long.class);
                Root<CourseEnrollment> e = enrolled.from(CourseEnrollment.class);
                enrolled.select(cb.count(e))
                        .where(cb.equal(e.get("course"), root), cb.isTrue(e.get("active")));
                query.orderBy(cb.desc(enrolled), cb.desc(root.get("createdAt")), cb.desc(root.get("id")));
            }
            return null;
        };
    }

    /**
     * Orders by average published rating; unrated courses sort as 0.
     */
    public static Specification<Course> orderByRating() {
        return (root, query, cb) -> {
            if (!isCountQuery(query)) {
                Subquery<Double> rating = query.subquery(Double.class);
                Root<CourseReview> r = rating.from(CourseReview.class);
                rating.select(cb.avg(r.get("rating")))
                        .where(cb.equal(r.get("course"), root), cb.isTrue(r.get("published")));
                Expression<Double> average = cb.coalesce(rating, 0.0);
                query.orderBy(cb.desc(average), cb.desc(root.get("createdAt")), cb.desc(root.get("id")));
            }
            return null;
        };
    }

    private static boolean isCountQuery(CriteriaQuery<?> query) {
        Class<?> type = query.getResultType();
        return type == Long.class || type == long.class;
    }
}
