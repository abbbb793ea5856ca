package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.Lesson;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LessonResponse {
    private Long id;
    private Long moduleId;
    private String title;
    private String description;
    private Lesson.LessonType lessonType;
    // omitted unless the caller may see the lesson body
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String content;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String videoUrl;
    private Integer durationMinutes;
    private Integer order;
    private boolean published;
    private boolean freePreview;
    private boolean completed;

    public static LessonResponse from(Lesson lesson, boolean includeContent, boolean completed) {
        return LessonResponse.builder()
                .id(lesson.getId())
                .moduleId(lesson.getModule().getId())
                .title(lesson.getTitle())
                .description(lesson.getDescription())
                .lessonType(lesson.getLessonType())
                .content(includeContent ? lesson.getContent() : null)
                .videoUrl(includeContent ? lesson.getVideoUrl() : null)
                .durationMinutes(lesson.getDurationMinutes())
                .order(lesson.getOrderNumber())
                .published(lesson.isPublished())
                .freePreview(lesson.isFreePreview())
                .completed(completed)
                .build();
    }
}
