package com.lesson.dedup.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Live pointer from an archived lesson id to the lesson that currently represents it.
 * Unlike {@link ArchiveRecord}, links are re-pointed when their target is archived in turn.
 */
public record CanonicalLink(String archivedLessonId, String canonicalId, Instant linkedAt) {

    public CanonicalLink {
        Objects.requireNonNull(archivedLessonId, "archivedLessonId is required");
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(linkedAt, "linkedAt is required");
    }

    public CanonicalLink withCanonical(String newCanonicalId) {
        return new CanonicalLink(archivedLessonId, newCanonicalId, linkedAt);
    }
}
