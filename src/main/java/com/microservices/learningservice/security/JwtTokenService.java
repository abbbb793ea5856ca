package com.microservices.learningservice.security;

import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.User;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Issues the access/refresh token pair handed out at login.
 */
@Service
@Slf4j
public class JwtTokenService {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_STAFF = "staff";
    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String ACCESS = "access";
    public static final String REFRESH = "refresh";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder refreshTokenDecoder;
    private final Clock clock;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;

    public JwtTokenService(JwtEncoder jwtEncoder,
                           @Qualifier("refreshTokenDecoder") JwtDecoder refreshTokenDecoder,
                           Clock clock,
                           @Value("${learning.jwt.issuer:learning-service}") String issuer,
                           @Value("${learning.jwt.access-token-ttl:60m}") Duration accessTokenTtl,
                           @Value("${learning.jwt.refresh-token-ttl:7d}") Duration refreshTokenTtl) {
        this.jwtEncoder = jwtEncoder;
        this.refreshTokenDecoder = refreshTokenDecoder;
        this.clock = clock;
        this.issuer = issuer;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
    }

    public TokenPair issue(User user, RoleName role) {
        Instant now = clock.instant();
        String access = encode(user, role, ACCESS, now, accessTokenTtl);
        String refresh = encode(user, role, REFRESH, now, refreshTokenTtl);
        log.debug("Issued token pair for user {}", user.getId());
        return TokenPair.builder()
                .accessToken(access)
                .refreshToken(refresh)
                .expiresIn(accessTokenTtl.toSeconds())
                .build();
    }

    /**
     * Decodes and validates a refresh token, returning the id of the user it was issued to.
     *
     * @throws JwtException if the token is malformed, expired, or not a refresh token
     */
    public Long parseRefreshToken(String refreshToken) {
        Jwt jwt = refreshTokenDecoder.decode(refreshToken);
        return Long.valueOf(jwt.getSubject());
    }

    private String encode(User user, RoleName role, String type, Instant now, Duration ttl) {
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .subject(String.valueOf(user.getId()))
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_STAFF, user.isStaff())
                .claim(CLAIM_TOKEN_TYPE, type);
        if (role != null) {
            claims.claim(CLAIM_ROLE, role.name());
        }
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    }

    @lombok.Value
    @Builder
    public static class TokenPair {
        String accessToken;
        String refreshToken;
        long expiresIn;
    }
}
