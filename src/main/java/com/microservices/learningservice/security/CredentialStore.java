package com.microservices.learningservice.security;

import com.microservices.learningservice.model.User;

/**
 * Account credentials. Passwords never leave this boundary in clear form.
 */
public interface CredentialStore {

    User createAccount(String email, String rawPassword);

    boolean verifyPassword(Long userId, String rawPassword);

    void setPassword(Long userId, String rawPassword);
}
