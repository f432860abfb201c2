package com.lesson.dedup.rest.dto;

import com.lesson.dedup.api.ArchiveReceipt;

/**
 * Response DTO for a successful single-lesson archival.
 */
public record ArchiveResponse(
        boolean success,
        String archivedId,
        String canonicalId,
        String archiveRecordId
) {
    public static ArchiveResponse from(ArchiveReceipt receipt) {
        return new ArchiveResponse(true, receipt.archivedLessonId(), receipt.canonicalLessonId(), receipt.archiveId());
    }
}
