package com.microservices.learningservice.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LessonProgressRequest {

    // null keeps the stored percentage
    @DecimalMin("0.00")
    @DecimalMax("100.00")
    private BigDecimal completionPercentage;

    @Min(0)
    private Integer timeSpentMinutes = 0;

    private boolean completed;
}
