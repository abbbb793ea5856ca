package com.microservices.learningservice.security;

/**
 * Source of collision-resistant identifiers for one-time tokens.
 */
public interface TokenGenerator {
    String newToken();
}
