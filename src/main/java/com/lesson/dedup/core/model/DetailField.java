package com.lesson.dedup.core.model;

import java.util.Locale;

/**
 * Single-valued descriptive fields of a lesson. The merge only fills these when the
 * canonical lesson has no value.
 */
public enum DetailField {
    LESSON_FORMAT,
    GROUP_SIZE,
    LOCATION,
    DURATION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DetailField fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Detail field must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
