package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.ProfileResponse;
import com.microservices.learningservice.dto.ProfileUpdateRequest;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserProfileService {

    private final UserProfileRepository profileRepository;

    @Transactional(readOnly = true)
    public ProfileResponse getProfile(Long userId) {
        return ProfileResponse.from(findProfile(userId));
    }

    @Transactional
    public ProfileResponse updateProfile(Long userId, ProfileUpdateRequest request) {
        UserProfile profile = findProfile(userId);
        if (request.getFirstName() != null) {
            profile.setFirstName(request.getFirstName());
        }
        if (request.getLastName() != null) {
            profile.setLastName(request.getLastName());
        }
        if (request.getAvatar() != null) {
            profile.setAvatar(request.getAvatar());
        }
        if (request.getPhoneNumber() != null) {
            profile.setPhoneNumber(request.getPhoneNumber());
        }
        if (request.getCountry() != null) {
            profile.setCountry(request.getCountry());
        }
        if (request.getLanguagePreference() != null) {
            profile.setLanguagePreference(request.getLanguagePreference());
        }
        if (request.getTimezone() != null) {
            profile.setTimezone(request.getTimezone());
        }
        UserProfile saved = profileRepository.save(profile);
        log.info("Updated profile of user {}", userId);
        return ProfileResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<ProfileResponse> listByRole(String roleName) {
        RoleName role = RoleName.parse(roleName)
                .orElseThrow(() -> new InvalidRequestException("role", "Unknown role: " + roleName));
        return profileRepository.findByRole_Name(role).stream()
                .map(ProfileResponse::from)
                .toList();
    }

    private UserProfile findProfile(Long userId) {
        return profileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Profile not found for user: " + userId));
    }
}
