package com.microservices.learningservice.service;

import com.microservices.learningservice.exception.MailDispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Account mails (verification, password reset). Called after the token row is committed,
 * so a dispatch failure is logged and the request still succeeds.
 */
@Service
@Slf4j
public class AccountMailService {

    private final Mailer mailer;
    private final String frontendUrl;

    public AccountMailService(Mailer mailer,
                              @Value("${learning.frontend.url:http://localhost:3000}") String frontendUrl) {
        this.mailer = mailer;
        this.frontendUrl = frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;
    }

    public boolean sendVerificationEmail(String email, String token) {
        String link = frontendUrl + "/verify-email?token=" + token;
        String body = "Welcome! Please confirm your email address by opening the link below.\n\n"
                + link + "\n\nThe link is valid for 24 hours.";
        return dispatch(email, "Verify your email address", body);
    }

    public boolean sendPasswordResetEmail(String email, String token) {
        String link = frontendUrl + "/reset-password?token=" + token;
        String body = "A password reset was requested for your account.\n\n"
                + link + "\n\nThe link is valid for 1 hour. If you did not request it, ignore this email.";
        return dispatch(email, "Reset your password", body);
    }

    private boolean dispatch(String email, String subject, String body) {
        try {
            mailer.send(email, subject, body);
            return true;
        } catch (MailDispatchException e) {
            log.warn("Could not send '{}' to {}: {}", subject, email, e.getMessage());
            return false;
        }
    }
}
