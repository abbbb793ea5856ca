package com.microservices.learningservice.util;

import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.security.Actor;
import com.microservices.learningservice.security.JwtTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

@Slf4j
public final class RoleUtil {

    private RoleUtil() {
    }

    /**
     * Resolves the caller from the bearer token. A missing token yields {@link Actor#ANONYMOUS}.
     */
    public static Actor actorOf(Jwt jwt) {
        if (jwt == null) {
            return Actor.ANONYMOUS;
        }
        Long userId;
        try {
            userId = Long.valueOf(jwt.getSubject());
        } catch (NumberFormatException e) {
            log.warn("Token subject is not a user id: {}", jwt.getSubject());
            return Actor.ANONYMOUS;
        }
        RoleName role = getRole(jwt).orElse(null);
        Boolean staff = jwt.getClaim(JwtTokenService.CLAIM_STAFF);
        return Actor.authenticated(userId, role, Boolean.TRUE.equals(staff));
    }

    private static Optional<RoleName> getRole(Jwt jwt) {
        if (jwt == null) {
            return Optional.empty();
        }
        Object roleClaim = jwt.getClaim(JwtTokenService.CLAIM_ROLE);
        if (roleClaim == null) {
            log.debug("No role claim in token for subject {}", jwt.getSubject());
            return Optional.empty();
        }
        return RoleName.parse(String.valueOf(roleClaim));
    }
}
