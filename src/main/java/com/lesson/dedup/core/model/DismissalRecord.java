package com.lesson.dedup.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A reviewer's decision that an exact set of lessons are distinct and should be kept.
 * Matching is by exact set equality: a subset or superset is a different group.
 */
public record DismissalRecord(
        String dismissalId,
        LessonIdSet lessonIds,
        String dismissedBy,
        Instant dismissedAt,
        DetectionMethod detectionMethod,
        String notes
) {
    public DismissalRecord {
        Objects.requireNonNull(dismissalId, "dismissalId is required");
        Objects.requireNonNull(lessonIds, "lessonIds is required");
        Objects.requireNonNull(dismissedAt, "dismissedAt is required");
    }

    public boolean matches(LessonIdSet candidate) {
        return lessonIds.equals(candidate);
    }

    public String groupKey() {
        return lessonIds.key();
    }
}
