package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.RegisterRequest;
import com.microservices.learningservice.exception.DuplicateResourceException;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.RoleRepository;
import com.microservices.learningservice.repository.UserProfileRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final UserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final RoleRepository roleRepository;
    private final CredentialStore credentialStore;
    private final VerificationTokenService verificationTokenService;

    /**
     * Creates the user, the profile and the first verification token in one transaction.
     */
    @Transactional
    public NewAccount register(RegisterRequest request) {
        if (!request.getPassword().equals(request.getPasswordConfirm())) {
            throw new InvalidRequestException("passwordConfirm", "Passwords do not match");
        }
        String email = normalizeEmail(request.getEmail());
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateResourceException("A user with this email already exists");
        }
        Optional<RoleName> roleName = RoleName.parse(request.getRoleName());
        if (roleName.filter(r -> r == RoleName.ADMIN).isPresent()) {
            throw new InvalidRequestException("roleName", "The Admin role cannot be self-assigned");
        }

        User user = credentialStore.createAccount(email, request.getPassword());

        UserProfile profile = new UserProfile(user);
        profile.setFirstName(nullToEmpty(request.getFirstName()));
        profile.setLastName(nullToEmpty(request.getLastName()));
        profile.setAvatar(nullToEmpty(request.getAvatar()));
        profile.setPhoneNumber(nullToEmpty(request.getPhoneNumber()));
        profile.setCountry(nullToEmpty(request.getCountry()));
        if (request.getLanguagePreference() != null) {
            profile.setLanguagePreference(request.getLanguagePreference());
        }
        if (request.getTimezone() != null) {
            profile.setTimezone(request.getTimezone());
        }
        roleName.flatMap(roleRepository::findByNameAndActiveTrue).ifPresentOrElse(
                profile::setRole,
                () -> log.warn("Role '{}' not found, registering {} without a role", request.getRoleName(), email));
        profileRepository.save(profile);

        String token = verificationTokenService.issueEmailVerification(user);
        log.info("Registered user {} ({})", user.getId(), email);
        return new NewAccount(user, profile, token);
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Value
    public static class NewAccount {
        User user;
        UserProfile profile;
        String verificationToken;
    }
}
