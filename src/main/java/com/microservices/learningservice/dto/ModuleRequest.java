package com.microservices.learningservice.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Null fields are left unchanged on update. A null order on create takes the next free position.
 */
@Data
public class ModuleRequest {

    @Size(max = 200)
    private String title;

    private String description;

    @Min(0)
    private Integer order;

    private Boolean published;
}
