package com.microservices.learningservice.dto;

import com.microservices.learningservice.model.UserProfile;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProfileResponse {
    private Long userId;
    private String email;
    private String firstName;
    private String lastName;
    private String avatar;
    private String phoneNumber;
    private String country;
    private String languagePreference;
    private String timezone;
    private String roleName;
    private boolean emailVerified;

    public static ProfileResponse from(UserProfile profile) {
        return ProfileResponse.builder()
                .userId(profile.getUser().getId())
                .email(profile.getUser().getEmail())
                .firstName(profile.getFirstName())
                .lastName(profile.getLastName())
                .avatar(profile.getAvatar())
                .phoneNumber(profile.getPhoneNumber())
                .country(profile.getCountry())
                .languagePreference(profile.getLanguagePreference())
                .timezone(profile.getTimezone())
                .roleName(profile.getRole() != null ? profile.getRole().getName().getDisplayName() : null)
                .emailVerified(profile.getUser().isEmailVerified())
                .build();
    }
}
