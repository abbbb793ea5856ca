package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.Course;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Create and partial-update body for a course. On update, null fields are left unchanged;
 * on create, title and description are required.
 */
@Data
public class CourseRequest {

    @Size(max = 200)
    private String title;

    private String description;

    private Course.CourseLanguage language;

    @DecimalMin("0.00")
    private BigDecimal price;

    private Course.Currency currency;

    private Boolean free;

    private String thumbnailUrl;

    private Course.CourseLevel level;

    @Min(0)
    private Integer durationHours;

    @Min(1)
    private Integer maxStudents;

    private String prerequisites;

    private String learningObjectives;

    @Size(max = 500)
    private String tags;

    private Set<Long> categoryIds;

    private Boolean published;
}
