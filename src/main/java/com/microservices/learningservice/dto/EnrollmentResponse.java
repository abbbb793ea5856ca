package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.CourseEnrollment;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class EnrollmentResponse {
    private Long id;
    private Long courseId;
    private String courseTitle;
    private String courseSlug;
    private Long studentId;
    private CourseEnrollment.EnrollmentStatus status;
    private boolean active;
    private BigDecimal progressPercentage;
    private LocalDateTime enrolledAt;
    private LocalDateTime completedAt;

    public static EnrollmentResponse from(CourseEnrollment enrollment) {
        return EnrollmentResponse.builder()
                .id(enrollment.getId())
                .courseId(enrollment.getCourse().getId())
                .courseTitle(enrollment.getCourse().getTitle())
                .courseSlug(enrollment.getCourse().getSlug())
                .studentId(enrollment.getStudent().getId())
                .status(enrollment.getStatus())
                .active(enrollment.isActive())
                .progressPercentage(enrollment.getProgressPercentage())
                .enrolledAt(enrollment.getEnrolledAt())
                .completedAt(enrollment.getCompletedAt())
                .build();
    }
}
