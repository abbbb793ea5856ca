package com.microservices.learningservice.model;

import java.util.Arrays;
import java.util.Optional;

public enum RoleName {
    ADMIN("Admin"),
    TEACHER("Teacher"),
    STUDENT("Student");

    private final String displayName;

    RoleName(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts both the display form ("Teacher") and the constant form ("TEACHER").
     */
    public static Optional<RoleName> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.name().equalsIgnoreCase(trimmed) || r.displayName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
