package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.Lesson;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Null fields are left unchanged on update. A null order on create takes the next free position.
 */
@Data
public class LessonRequest {

    @Size(max = 200)
    private String title;

    private String description;

    private Lesson.LessonType lessonType;

    private String content;

    private String videoUrl;

    @Min(0)
    private Integer durationMinutes;

    @Min(0)
    private Integer order;

    private Boolean published;

    private Boolean freePreview;
}
