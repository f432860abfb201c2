package com.lesson.dedup.security;

import java.util.Locale;

/**
 * Role stored on a user profile.
 */
public enum ProfileRole {
    TEACHER,
    REVIEWER,
    ADMIN,
    SUPER_ADMIN;

    /**
     * Whether holders of this role may review and resolve duplicate lessons.
     */
    public boolean canReviewDuplicates() {
        return this != TEACHER;
    }

    /**
     * Parses a stored role name case-insensitively.
     *
     * @throws IllegalArgumentException for null, blank or unknown values
     */
    public static ProfileRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role must not be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown role: " + value, e);
        }
    }
}
