package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.Course;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class CourseDetail {
    private Long id;
    private String title;
    private String slug;
    private String description;
    private TeacherSummary teacher;
    private Course.CourseLanguage language;
    private BigDecimal price;
    private Course.Currency currency;
    private boolean free;
    private boolean published;
    private String thumbnailUrl;
    private Course.CourseLevel level;
    private Integer durationHours;
    private Integer maxStudents;
    private String prerequisites;
    private String learningObjectives;
    private String tags;
    private List<CategoryResponse> categories;
    private long enrolledCount;
    private double averageRating;
    private long reviewsCount;
    private boolean enrolled;
    private EnrollmentStatusView enrollmentStatus;
    private List<ModuleResponse> modules;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
