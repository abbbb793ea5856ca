package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.LessonProgress;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class LessonProgressResponse {
    private Long id;
    private Long lessonId;
    private String lessonTitle;
    private boolean completed;
    private BigDecimal completionPercentage;
    private Integer timeSpentMinutes;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private BigDecimal courseProgressPercentage;

    public static LessonProgressResponse from(LessonProgress progress, BigDecimal courseProgress) {
        return LessonProgressResponse.builder()
                .id(progress.getId())
                .lessonId(progress.getLesson().getId())
                .lessonTitle(progress.getLesson().getTitle())
                .completed(progress.isCompleted())
                .completionPercentage(progress.getCompletionPercentage())
                .timeSpentMinutes(progress.getTimeSpentMinutes())
                .startedAt(progress.getStartedAt())
                .completedAt(progress.getCompletedAt())
                .courseProgressPercentage(courseProgress)
                .build();
    }
}
