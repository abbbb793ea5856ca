package com.microservices.learningservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Null fields are left unchanged on update; title is required on create.
 */
@Data
public class CategoryRequest {

    @Size(max = 100)
    private String title;

    private String iconSrc;

    private String description;

    private Boolean active;
}
