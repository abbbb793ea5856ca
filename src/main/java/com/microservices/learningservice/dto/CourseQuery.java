package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.Course;
import lombok.Data;

/**
 * Catalog listing filters, bound from query parameters.
 */
@Data
public class CourseQuery {
    private String search;
    private String category;
    private Course.CourseLevel level;
    private Course.CourseLanguage language;
    // "free" or "paid"
    private String price;
    private Long teacher;
    // newest, popular, rating, price_low, price_high
    private String sort = "newest";
    private Integer page;
    private Integer pageSize;
}
