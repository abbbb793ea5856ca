package com.microservices.learningservice.service;

import com.microservices.learningservice.exception.TokenAlreadyUsedException;
import com.microservices.learningservice.exception.TokenExpiredException;
import com.microservices.learningservice.exception.TokenNotFoundException;
import com.microservices.learningservice.model.EmailVerificationToken;
import com.microservices.learningservice.model.PasswordResetToken;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.repository.EmailVerificationTokenRepository;
import com.microservices.learningservice.repository.PasswordResetTokenRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.CredentialStore;
import com.microservices.learningservice.security.TokenGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One-time email verification and password reset tokens.
 * <p>
 * A user holds at most one verification token; issuing a new one replaces the old.
 * Reset tokens accumulate, each with its own {@code used} flag, and are never deleted.
 * Validation fails in this order: unknown token, expired token, already used.
 */
@Service
@Slf4j
public class VerificationTokenService {

    private final EmailVerificationTokenRepository verificationTokenRepository;
    private final PasswordResetTokenRepository resetTokenRepository;
    private final UserRepository userRepository;
    private final CredentialStore credentialStore;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;
    private final Duration verificationTtl;
    private final Duration resetTtl;

    public VerificationTokenService(EmailVerificationTokenRepository verificationTokenRepository,
                                    PasswordResetTokenRepository resetTokenRepository,
                                    UserRepository userRepository,
                                    CredentialStore credentialStore,
                                    TokenGenerator tokenGenerator,
                                    Clock clock,
                                    @Value("${learning.tokens.email-verification-ttl:24h}") Duration verificationTtl,
                                    @Value("${learning.tokens.password-reset-ttl:1h}") Duration resetTtl) {
        this.verificationTokenRepository = verificationTokenRepository;
        this.resetTokenRepository = resetTokenRepository;
        this.userRepository = userRepository;
        this.credentialStore = credentialStore;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.verificationTtl = verificationTtl;
        this.resetTtl = resetTtl;
    }

    @Transactional
    public String issueEmailVerification(User user) {
        int removed = verificationTokenRepository.deleteAllForUser(user.getId());
        if (removed > 0) {
            log.debug("Replaced {} verification token(s) for user {}", removed, user.getId());
        }
        EmailVerificationToken token = new EmailVerificationToken(user, tokenGenerator.newToken(), now());
        verificationTokenRepository.save(token);
        log.info("Issued email verification token for user {}", user.getId());
        return token.getToken();
    }

    @Transactional
    public String issuePasswordReset(User user) {
        PasswordResetToken token = new PasswordResetToken(user, tokenGenerator.newToken(), now());
        resetTokenRepository.save(token);
        log.info("Issued password reset token for user {}", user.getId());
        return token.getToken();
    }

    /**
     * Marks the token's user as verified and deletes the token.
     */
    @Transactional
    public User verifyEmail(String tokenValue) {
        EmailVerificationToken token = verificationTokenRepository.findByToken(tokenValue)
                .orElseThrow(() -> new TokenNotFoundException("Invalid verification token"));
        if (token.isExpired(now(), verificationTtl)) {
            log.warn("Expired verification token used for user {}", token.getUser().getId());
            throw new TokenExpiredException("Verification token has expired");
        }
        User user = token.getUser();
        user.setEmailVerified(true);
        userRepository.save(user);
        verificationTokenRepository.delete(token);
        log.info("Email verified for user {}", user.getId());
        return user;
    }

    /**
     * Sets the new password and marks the token used. The token row is kept.
     */
    @Transactional
    public User resetPassword(String tokenValue, String newPassword) {
        PasswordResetToken token = resetTokenRepository.findByToken(tokenValue)
                .orElseThrow(() -> new TokenNotFoundException("Invalid reset token"));
        if (token.isExpired(now(), resetTtl)) {
            log.warn("Expired reset token used for user {}", token.getUser().getId());
            throw new TokenExpiredException("Reset token has expired");
        }
        if (token.isUsed()) {
            log.warn("Reused reset token for user {}", token.getUser().getId());
            throw new TokenAlreadyUsedException("Reset token has already been used");
        }
        credentialStore.setPassword(token.getUser().getId(), newPassword);
        token.setUsed(true);
        resetTokenRepository.save(token);
        log.info("Password reset for user {}", token.getUser().getId());
        return token.getUser();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
