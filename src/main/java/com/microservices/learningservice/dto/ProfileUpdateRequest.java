package com.microservices.learningservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Null fields are left unchanged.
 */
@Data
public class ProfileUpdateRequest {

    @Size(max = 50)
    private String firstName;

    @Size(max = 50)
    private String lastName;

    private String avatar;

    @Size(max = 20)
    private String phoneNumber;

    @Size(max = 100)
    private String country;

    @Size(max = 10)
    private String languagePreference;

    @Size(max = 50)
    private String timezone;
}
