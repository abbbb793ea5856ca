package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.CourseEnrollment;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class EnrollmentStatusView {
    private CourseEnrollment.EnrollmentStatus status;
    private boolean active;
    private BigDecimal progressPercentage;
    private LocalDateTime enrolledAt;
    private LocalDateTime completedAt;

    public static EnrollmentStatusView from(CourseEnrollment enrollment) {
        return EnrollmentStatusView.builder()
                .status(enrollment.getStatus())
                .active(enrollment.isActive())
                .progressPercentage(enrollment.getProgressPercentage())
                .enrolledAt(enrollment.getEnrolledAt())
                .completedAt(enrollment.getCompletedAt())
                .build();
    }
}
