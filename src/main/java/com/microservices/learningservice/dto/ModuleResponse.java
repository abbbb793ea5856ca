package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.CourseModule;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ModuleResponse {
    private Long id;
    private Long courseId;
    private String title;
    private String description;
    private Integer order;
    private boolean published;
    private List<LessonResponse> lessons;

    public static ModuleResponse from(CourseModule module, List<LessonResponse> lessons) {
        return ModuleResponse.builder()
                .id(module.getId())
                .courseId(module.getCourse().getId())
                .title(module.getTitle())
                .description(module.getDescription())
                .order(module.getOrderNumber())
                .published(module.isPublished())
                .lessons(lessons)
                .build();
    }
}
