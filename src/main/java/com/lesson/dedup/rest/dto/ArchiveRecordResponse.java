package com.lesson.dedup.rest.dto;

import com.lesson.dedup.core.model.ArchiveRecord;

import java.time.Instant;

/**
 * Response DTO for an archive record. The snapshot is summarized by its title.
 */
public record ArchiveRecordResponse(
        String archiveId,
        String lessonId,
        String title,
        String canonicalId,
        String archivedBy,
        Instant archivedAt,
        String archiveReason
) {
    public static ArchiveRecordResponse from(ArchiveRecord archive) {
        return new ArchiveRecordResponse(archive.archiveId(), archive.lessonId(), archive.snapshot().getTitle(),
                archive.canonicalId(), archive.archivedBy(), archive.archivedAt(), archive.archiveReason());
    }
}
