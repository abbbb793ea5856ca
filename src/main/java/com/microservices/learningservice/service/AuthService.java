package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.AuthResponse;
import com.microservices.learningservice.dto.ChangePasswordRequest;
import com.microservices.learningservice.dto.LoginRequest;
import com.microservices.learningservice.dto.ProfileResponse;
import com.microservices.learningservice.dto.RegisterRequest;
import com.microservices.learningservice.dto.ResetPasswordRequest;
import com.microservices.learningservice.exception.InvalidCredentialsException;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Role;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.UserProfileRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.CredentialStore;
import com.microservices.learningservice.security.JwtTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Account flows behind {@code /api/auth}. Flows that send mail are not transactional
 * themselves: the state change commits first, then the mail is queued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final AccountService accountService;
    private final UserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final CredentialStore credentialStore;
    private final VerificationTokenService verificationTokenService;
    private final AccountMailService accountMailService;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthResponse register(RegisterRequest request) {
        AccountService.NewAccount account = accountService.register(request);
        User user = account.getUser();
        RoleName role = roleOf(account.getProfile()).orElse(null);
        JwtTokenService.TokenPair tokens = jwtTokenService.issue(user, role);

        accountMailService.sendVerificationEmail(user.getEmail(), account.getVerificationToken());

        return AuthResponse.builder()
                .userId(user.getId())
                .email(user.getEmail())
                .access(tokens.getAccessToken())
                .refresh(tokens.getRefreshToken())
                .expiresIn(tokens.getExpiresIn())
                .build();
    }

    @Transactional
    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByEmailIgnoreCase(AccountService.normalizeEmail(request.getEmail()))
                .orElseThrow(InvalidCredentialsException::new);
        if (!credentialStore.verifyPassword(user.getId(), request.getPassword())) {
            log.warn("Failed login for {}", user.getEmail());
            throw new InvalidCredentialsException();
        }
        if (!user.isActive()) {
            log.warn("Login attempt on disabled account {}", user.getId());
            throw new PermissionDeniedException("User account is disabled");
        }
        user.setLastLogin(LocalDateTime.now(clock));
        userRepository.save(user);

        UserProfile profile = profileRepository.findById(user.getId()).orElse(null);
        JwtTokenService.TokenPair tokens = jwtTokenService.issue(user, roleOf(profile).orElse(null));
        log.info("User {} logged in", user.getId());

        return AuthResponse.builder()
                .userId(user.getId())
                .email(user.getEmail())
                .access(tokens.getAccessToken())
                .refresh(tokens.getRefreshToken())
                .expiresIn(tokens.getExpiresIn())
                .profile(profile != null ? ProfileResponse.from(profile) : null)
                .build();
    }

    @Transactional(readOnly = true)
    public AuthResponse refresh(String refreshToken) {
        Long userId;
        try {
            userId = jwtTokenService.parseRefreshToken(refreshToken);
        } catch (JwtException | NumberFormatException e) {
            log.debug("Rejected refresh token: {}", e.getMessage());
            throw new InvalidRequestException("refresh", "Invalid or expired refresh token");
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new InvalidRequestException("refresh", "Invalid or expired refresh token"));
        if (!user.isActive()) {
            throw new PermissionDeniedException("User account is disabled");
        }
        RoleName role = profileRepository.findById(userId).flatMap(AuthService::roleOf).orElse(null);
        JwtTokenService.TokenPair tokens = jwtTokenService.issue(user, role);
        return AuthResponse.builder()
                .userId(user.getId())
                .email(user.getEmail())
                .access(tokens.getAccessToken())
                .refresh(tokens.getRefreshToken())
                .expiresIn(tokens.getExpiresIn())
                .build();
    }

    @Transactional
    public void changePassword(Long userId, ChangePasswordRequest request) {
        if (!request.getNewPassword().equals(request.getNewPasswordConfirm())) {
            throw new InvalidRequestException("newPasswordConfirm", "New passwords do not match");
        }
        if (!credentialStore.verifyPassword(userId, request.getOldPassword())) {
            throw new InvalidRequestException("oldPassword", "Old password is incorrect");
        }
        credentialStore.setPassword(userId, request.getNewPassword());
    }

    public void forgotPassword(String email) {
        User user = userRepository.findByEmailIgnoreCase(AccountService.normalizeEmail(email))
                .orElseThrow(() -> new InvalidRequestException("email", "User with this email does not exist"));
        String token = verificationTokenService.issuePasswordReset(user);
        accountMailService.sendPasswordResetEmail(user.getEmail(), token);
    }

    public void resetPassword(ResetPasswordRequest request) {
        if (!request.getNewPassword().equals(request.getNewPasswordConfirm())) {
            throw new InvalidRequestException("newPasswordConfirm", "New passwords do not match");
        }
        verificationTokenService.resetPassword(request.getToken(), request.getNewPassword());
    }

    public void verifyEmail(String token) {
        verificationTokenService.verifyEmail(token);
    }

    public void resendVerification(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        if (user.isEmailVerified()) {
            throw new InvalidRequestException("Email is already verified");
        }
        String token = verificationTokenService.issueEmailVerification(user);
        accountMailService.sendVerificationEmail(user.getEmail(), token);
    }

    private static Optional<RoleName> roleOf(UserProfile profile) {
        return Optional.ofNullable(profile).map(UserProfile::getRole).filter(Role::isActive).map(Role::getName);
    }
}
