package com.microservices.learningservice.service;

import com.microservices.learningservice.model.Role;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.RoleRepository;
import com.microservices.learningservice.repository.UserProfileRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Startup seeding: the three roles, and an admin account when one is configured.
 */
@Service
@Slf4j
public class AccountBootstrapService {

    private static final Map<RoleName, String> ROLE_DESCRIPTIONS = Map.of(
            RoleName.ADMIN, "Platform administrator",
            RoleName.TEACHER, "Creates and manages courses",
            RoleName.STUDENT, "Enrolls in courses and tracks progress"
    );

    private final RoleRepository roleRepository;
    private final UserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final CredentialStore credentialStore;
    private final String adminEmail;
    private final String adminPassword;

    public AccountBootstrapService(RoleRepository roleRepository,
                                   UserRepository userRepository,
                                   UserProfileRepository profileRepository,
                                   CredentialStore credentialStore,
                                   @Value("${learning.admin.email:}") String adminEmail,
                                   @Value("${learning.admin.password:}") String adminPassword) {
        this.roleRepository = roleRepository;
        this.userRepository = userRepository;
        this.profileRepository = profileRepository;
        this.credentialStore = credentialStore;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
    }

    @Transactional
    public void ensureRoles() {
        for (RoleName name : RoleName.values()) {
            if (roleRepository.findByName(name).isEmpty()) {
                roleRepository.save(new Role(name, ROLE_DESCRIPTIONS.get(name)));
                log.info("Created role {}", name.getDisplayName());
            }
        }
    }

    @Transactional
    public void ensureAdminAccount() {
        if (adminEmail == null || adminEmail.isBlank()) {
            log.debug("No admin account configured");
            return;
        }
        if (adminPassword == null || adminPassword.length() < 8) {
            log.warn("Admin password missing or shorter than 8 characters, skipping admin bootstrap");
            return;
        }
        String email = adminEmail.trim().toLowerCase();
        if (userRepository.existsByEmailIgnoreCase(email)) {
            log.debug("Admin account {} already exists", email);
            return;
        }
        User admin = credentialStore.createAccount(email, adminPassword);
        admin.setStaff(true);
        admin.setEmailVerified(true);
        userRepository.save(admin);

        UserProfile profile = new UserProfile(admin);
        profile.setFirstName("Admin");
        roleRepository.findByNameAndActiveTrue(RoleName.ADMIN).ifPresent(profile::setRole);
        profileRepository.save(profile);
        log.info("Created admin account {}", email);
    }
}
