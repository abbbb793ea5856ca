package com.microservices.learningservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class ReviewResponse {
    private Long id;
    private Integer rating;
    private String reviewText;
    private String studentName;
    private String studentAvatar;
    private LocalDateTime createdAt;
}
