package com.lesson.dedup.core.model;

import java.util.Locale;

/**
 * How a pair or group of lessons was detected as duplicate.
 * Pairs only ever carry SAME_TITLE, EMBEDDING or BOTH; MIXED describes a group
 * whose pairs were found by different methods.
 */
public enum DetectionMethod {
    BOTH("both", 1),
    SAME_TITLE("same_title", 2),
    EMBEDDING("embedding", 3),
    MIXED("mixed", 4);

    private final String wireName;
    private final int priority;

    DetectionMethod(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    /**
     * Lowercase name used in storage and on the wire.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Sort priority for pair ordering; lower sorts first.
     */
    public int priority() {
        return priority;
    }

    /**
     * Parses a wire name case-insensitively.
     *
     * @throws IllegalArgumentException for null, blank or unknown values
     */
    public static DetectionMethod fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Detection method must not be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DetectionMethod method : values()) {
            if (method.wireName.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + value);
    }
}
