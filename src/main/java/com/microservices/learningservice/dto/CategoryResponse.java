package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.Category;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class CategoryResponse {
    private Long id;
    private String title;
    private String iconSrc;
    private String description;
    private boolean active;
    private Long coursesCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CategoryResponse from(Category category, Long coursesCount) {
        return CategoryResponse.builder()
                .id(category.getId())
                .title(category.getTitle())
                .iconSrc(category.getIconSrc())
                .description(category.getDescription())
                .active(category.isActive())
                .coursesCount(coursesCount)
                .createdAt(category.getCreatedAt())
                .updatedAt(category.getUpdatedAt())
                .build();
    }
}
