package com.microservices.learningservice.service;

import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@Slf4j
public class UserCredentialService implements CredentialStore {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserCredentialService(UserRepository userRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Override
    @Transactional
    public User createAccount(String email, String rawPassword) {
        User user = new User(email, passwordEncoder.encode(rawPassword));
        user.setDateJoined(LocalDateTime.now(clock));
        User saved = userRepository.save(user);
        log.debug("Created account {} for {}", saved.getId(), email);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean verifyPassword(Long userId, String rawPassword) {
        if (rawPassword == null) {
            return false;
        }
        return userRepository.findById(userId)
                .map(u -> passwordEncoder.matches(rawPassword, u.getPasswordHash()))
                .orElse(false);
    }

    @Override
    @Transactional
    public void setPassword(Long userId, String rawPassword) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        userRepository.save(user);
        log.info("Password changed for user {}", userId);
    }
}
