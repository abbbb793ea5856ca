package com.microservices.learningservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RegisterRequest {

    @NotBlank
    @Email
    private String email;

    @NotBlank
    @Size(min = 8, message = "Password must be at least 8 characters")
    private String password;

    @NotBlank
    private String passwordConfirm;

    // "Admin", "Teacher" or "Student"; defaults to Student
    private String roleName = "Student";

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
    private String languagePreference = "en";

    @Size(max = 50)
    private String timezone = "UTC";
}
