package com.microservices.learningservice.service;

import com.microservices.learningservice.TestData;
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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationTokenServiceTest {

    private static final LocalDateTime ISSUED_AT = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Mock
    private EmailVerificationTokenRepository verificationTokenRepository;
    @Mock
    private PasswordResetTokenRepository resetTokenRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private CredentialStore credentialStore;
    @Mock
    private TokenGenerator tokenGenerator;

    private final User user = TestData.user(7L, "user@example.com");

    private VerificationTokenService serviceAt(LocalDateTime now) {
        Clock clock = Clock.fixed(now.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new VerificationTokenService(verificationTokenRepository, resetTokenRepository, userRepository,
                credentialStore, tokenGenerator, clock, Duration.ofHours(24), Duration.ofHours(1));
    }

    @Test
    void issuingVerificationTokenReplacesPreviousOne() {
        when(tokenGenerator.newToken()).thenReturn("a1b2c3");

        String token = serviceAt(ISSUED_AT).issueEmailVerification(user);

        assertThat(token).isEqualTo("a1b2c3");
        ArgumentCaptor<EmailVerificationToken> saved = ArgumentCaptor.forClass(EmailVerificationToken.class);
        InOrder order = inOrder(verificationTokenRepository);
        order.verify(verificationTokenRepository).deleteAllForUser(7L);
        order.verify(verificationTokenRepository).save(saved.capture());
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(ISSUED_AT);
        assertThat(saved.getValue().getUser()).isSameAs(user);
    }

    @Test
    void verificationTokenAcceptedJustBeforeExpiry() {
        EmailVerificationToken token = new EmailVerificationToken(user, "tok", ISSUED_AT);
        when(verificationTokenRepository.findByToken("tok")).thenReturn(Optional.of(token));

        serviceAt(ISSUED_AT.plusHours(23).plusMinutes(59)).verifyEmail("tok");

        assertThat(user.isEmailVerified()).isTrue();
        verify(userRepository).save(user);
        verify(verificationTokenRepository).delete(token);
    }

    @Test
    void verificationTokenRejectedJustAfterExpiry() {
        EmailVerificationToken token = new EmailVerificationToken(user, "tok", ISSUED_AT);
        when(verificationTokenRepository.findByToken("tok")).thenReturn(Optional.of(token));

        assertThatThrownBy(() -> serviceAt(ISSUED_AT.plusHours(24).plusMinutes(1)).verifyEmail("tok"))
                .isInstanceOf(TokenExpiredException.class);
        assertThat(user.isEmailVerified()).isFalse();
        verify(verificationTokenRepository, never()).delete(any(EmailVerificationToken.class));
    }

    @Test
    void unknownVerificationTokenIsRejected() {
        when(verificationTokenRepository.findByToken("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> serviceAt(ISSUED_AT).verifyEmail("missing"))
                .isInstanceOf(TokenNotFoundException.class);
    }

    @Test
    void resetTokenWorksExactlyOnce() {
        PasswordResetToken token = new PasswordResetToken(user, "reset", ISSUED_AT);
        when(resetTokenRepository.findByToken("reset")).thenReturn(Optional.of(token));
        VerificationTokenService service = serviceAt(ISSUED_AT.plusMinutes(10));

        service.resetPassword("reset", "new-password-1");

        assertThat(token.isUsed()).isTrue();
        verify(credentialStore).setPassword(7L, "new-password-1");

        assertThatThrownBy(() -> service.resetPassword("reset", "new-password-2"))
                .isInstanceOf(TokenAlreadyUsedException.class);
        verify(credentialStore, times(1)).setPassword(any(), anyString());
    }

    @Test
    void resetTokenExpiresAfterOneHour() {
        PasswordResetToken token = new PasswordResetToken(user, "reset", ISSUED_AT);
        when(resetTokenRepository.findByToken("reset")).thenReturn(Optional.of(token));

        assertThatThrownBy(() -> serviceAt(ISSUED_AT.plusMinutes(61)).resetPassword("reset", "new-password-1"))
                .isInstanceOf(TokenExpiredException.class);
        assertThat(token.isUsed()).isFalse();
    }

    @Test
    void expiryIsReportedBeforeReuse() {
        PasswordResetToken token = new PasswordResetToken(user, "reset", ISSUED_AT);
        token.setUsed(true);
        when(resetTokenRepository.findByToken("reset")).thenReturn(Optional.of(token));

        assertThatThrownBy(() -> serviceAt(ISSUED_AT.plusHours(2)).resetPassword("reset", "new-password-1"))
                .isInstanceOf(TokenExpiredException.class);
    }

    @Test
    void passwordResetTokensAccumulate() {
        when(tokenGenerator.newToken()).thenReturn("first", "second");
        VerificationTokenService service = serviceAt(ISSUED_AT);

        assertThat(service.issuePasswordReset(user)).isEqualTo("first");
        assertThat(service.issuePasswordReset(user)).isEqualTo("second");
        verify(resetTokenRepository, times(2)).save(any(PasswordResetToken.class));
    }
}
