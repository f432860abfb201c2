package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Removes a duplicate lesson while keeping a full snapshot of it.
 *
 * <p>Runs inside the caller's transaction. It validates first: ids distinct, both lessons
 * live, no archive yet for the duplicate. It then hands the {@link ArchiveRecord} snapshot to
 * {@link StoreSession#archiveLesson}, which stores it, re-points canonical links that target
 * the duplicate, links the duplicate to the canonical and deletes the live duplicate as one
 * step. The engine never commits; an exception leaves the whole transaction to roll back.</p>
 */
public class ArchivalEngine {
    private static final Logger log = LoggerFactory.getLogger(ArchivalEngine.class);

    public static final String DEFAULT_ARCHIVE_REASON = "duplicate_resolution";

    private final String archiveReason;

    public ArchivalEngine() {
        this(DEFAULT_ARCHIVE_REASON);
    }

    public ArchivalEngine(String archiveReason) {
        this.archiveReason = archiveReason;
    }

    /**
     * Outcome of one archival.
     *
     * @param repointedLinks number of older canonical links moved onto the new canonical
     */
    public record ArchiveOutcome(ArchiveRecord archive, int repointedLinks) {
    }

    public ArchiveOutcome archive(StoreSession session, String duplicateId, String canonicalId,
                                  String actorId, Instant now) {
        requireId(duplicateId, "duplicateId");
        requireId(canonicalId, "canonicalId");
        if (duplicateId.equals(canonicalId)) {
            throw ResolutionException.invalidArgument("A lesson cannot be archived as a duplicate of itself: " + duplicateId);
        }

        Optional<LessonRecord> duplicate = session.findLesson(duplicateId);
        if (duplicate.isEmpty()) {
            throw session.findArchive(duplicateId)
                    .map(existing -> ResolutionException.notFound(
                            "Lesson not found: " + duplicateId,
                            "Lesson was already archived (archive " + existing.archiveId()
                                    + ", canonical " + existing.canonicalId() + ")"))
                    .orElseGet(() -> ResolutionException.notFound("Lesson not found: " + duplicateId));
        }
        if (session.findLesson(canonicalId).isEmpty()) {
            throw session.findArchive(canonicalId)
                    .map(existing -> ResolutionException.notFound(
                            "Canonical lesson not found: " + canonicalId,
                            "Canonical lesson was itself archived; choose " + existing.canonicalId() + " instead"))
                    .orElseGet(() -> ResolutionException.notFound("Canonical lesson not found: " + canonicalId));
        }
        session.findArchive(duplicateId).ifPresent(existing -> {
            throw ResolutionException.conflict(
                    "Lesson " + duplicateId + " already has archive record " + existing.archiveId(),
                    "Remove the stale live copy through ingestion before archiving again");
        });

        ArchiveRecord archive = ArchiveRecord.of(duplicate.get(), canonicalId, actorId, archiveReason, now);
        int repointed = session.archiveLesson(archive);

        log.debug("archive.applied duplicateId={} canonicalId={} archiveId={} repointedLinks={}",
                duplicateId, canonicalId, archive.archiveId(), repointed);
        return new ArchiveOutcome(archive, repointed);
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw ResolutionException.invalidArgument(name + " must not be blank");
        }
    }
}
