package com.lesson.dedup.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of a lesson removed as a duplicate.
 *
 * @param archiveId     unique id of this archive row
 * @param snapshot      full copy of the lesson as it was when archived
 * @param archivedBy    caller that performed the archival
 * @param archivedAt    when the archival committed
 * @param archiveReason reason code, normally {@code duplicate_resolution}
 * @param canonicalId   canonical lesson chosen at archival time
 */
public record ArchiveRecord(
        String archiveId,
        LessonRecord snapshot,
        String archivedBy,
        Instant archivedAt,
        String archiveReason,
        String canonicalId
) {
    public ArchiveRecord {
        Objects.requireNonNull(archiveId, "archiveId is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
        Objects.requireNonNull(archivedAt, "archivedAt is required");
        Objects.requireNonNull(canonicalId, "canonicalId is required");
    }

    /**
     * Creates a record for the given lesson with a fresh archive id.
     */
    public static ArchiveRecord of(LessonRecord lesson, String canonicalId, String archivedBy,
                                   String archiveReason, Instant archivedAt) {
        return new ArchiveRecord(UUID.randomUUID().toString(), lesson, archivedBy, archivedAt,
                archiveReason, canonicalId);
    }

    /**
     * Id of the archived lesson.
     */
    public String lessonId() {
        return snapshot.getLessonId();
    }
}
