package com.microservices.learningservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    private Long userId;
    private String email;
    private String access;
    private String refresh;
    private Long expiresIn;
    private ProfileResponse profile;
}
