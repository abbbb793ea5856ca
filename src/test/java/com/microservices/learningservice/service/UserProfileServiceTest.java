package com.microservices.learningservice.service;

import com.microservices.learningservice.TestData;
import com.microservices.learningservice.dto.ProfileResponse;
import com.microservices.learningservice.dto.ProfileUpdateRequest;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Role;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.UserProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserProfileServiceTest {

    @Mock
    private UserProfileRepository profileRepository;

    private UserProfileService profileService;
    private UserProfile profile;

    @BeforeEach
    void setUp() {
        profileService = new UserProfileService(profileRepository);
        profile = new UserProfile(TestData.user(5L, "ada@example.com"));
        profile.setId(5L);
        profile.setFirstName("Ada");
        profile.setLastName("Lovelace");
        profile.setRole(new Role(RoleName.TEACHER, "Teachers"));
    }

    @Test
    void listsUsersByRoleName() {
        when(profileRepository.findByRole_Name(RoleName.TEACHER)).thenReturn(List.of(profile));

        List<ProfileResponse> teachers = profileService.listByRole("teacher");

        assertThat(teachers).extracting(ProfileResponse::getEmail).containsExactly("ada@example.com");
        assertThat(teachers.get(0).getRoleName()).isEqualTo("Teacher");
    }

    @Test
    void unknownRoleIsRejected() {
        assertThatThrownBy(() -> profileService.listByRole("wizard"))
                .isInstanceOfSatisfying(InvalidRequestException.class, e ->
                        assertThat(e.getFieldErrors()).containsKey("role"));
        verifyNoInteractions(profileRepository);
    }

    @Test
    void updateChangesOnlyProvidedFields() {
        ProfileUpdateRequest request = new ProfileUpdateRequest();
        request.setFirstName("Augusta");
        request.setCountry("UK");
        when(profileRepository.findById(5L)).thenReturn(Optional.of(profile));
        when(profileRepository.save(any(UserProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        ProfileResponse updated = profileService.updateProfile(5L, request);

        assertThat(updated.getFirstName()).isEqualTo("Augusta");
        assertThat(updated.getLastName()).isEqualTo("Lovelace");
        assertThat(updated.getCountry()).isEqualTo("UK");
        assertThat(updated.getTimezone()).isEqualTo("UTC");
    }

    @Test
    void missingProfileIsNotFound() {
        when(profileRepository.findById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> profileService.getProfile(8L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
