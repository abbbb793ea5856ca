package com.microservices.learningservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TeacherSummary {
    private Long id;
    private String email;
    private String firstName;
    private String lastName;
    private String avatar;
}
