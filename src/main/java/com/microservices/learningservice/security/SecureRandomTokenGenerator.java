package com.microservices.learningservice.security;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * 128 random bits rendered as 32 lowercase hex characters.
 */
@Component
public class SecureRandomTokenGenerator implements TokenGenerator {

    private static final int TOKEN_BYTES = 16;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
