package com.microservices.learningservice.security;

import com.microservices.learningservice.model.RoleName;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The caller of a request, resolved once from the bearer token.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Actor {

    public static final Actor ANONYMOUS = new Actor(null, null, false);

    Long userId;
    RoleName role;
    boolean staff;

    public static Actor authenticated(Long userId, RoleName role, boolean staff) {
        if (userId == null) {
            throw new IllegalArgumentException("Authenticated actor requires a user id");
        }
        return new Actor(userId, role, staff);
    }

    public boolean isAnonymous() {
        return userId == null;
    }

    public boolean hasRole(RoleName roleName) {
        return role == roleName;
    }

    public boolean isAdmin() {
        return staff || role == RoleName.ADMIN;
    }
}
