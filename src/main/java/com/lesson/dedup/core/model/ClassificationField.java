package com.lesson.dedup.core.model;

import java.util.Locale;

/**
 * Set-valued classification fields of a lesson. These are unioned by the metadata merge.
 */
public enum ClassificationField {
    GRADE_LEVELS,
    THEMATIC_CATEGORIES,
    SEASON_TIMING,
    OBSERVANCES_HOLIDAYS,
    MAIN_INGREDIENTS,
    GARDEN_SKILLS,
    COOKING_SKILLS,
    ACADEMIC_INTEGRATION,
    SOCIAL_EMOTIONAL_LEARNING,
    CULTURAL_HERITAGE,
    LOCATION_REQUIREMENTS,
    COOKING_METHODS,
    CORE_COMPETENCIES,
    CULTURAL_RESPONSIVENESS_FEATURES,
    ACTIVITY_TYPE,
    TAGS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClassificationField fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Classification field must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
