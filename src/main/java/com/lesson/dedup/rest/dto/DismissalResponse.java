package com.lesson.dedup.rest.dto;

import com.lesson.dedup.core.model.DismissalRecord;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a recorded dismissal.
 */
public record DismissalResponse(
        boolean success,
        String dismissalId,
        List<String> lessonIds,
        String dismissedBy,
        Instant dismissedAt,
        String detectionMethod,
        String notes
) {
    public static DismissalResponse from(DismissalRecord record) {
        return new DismissalResponse(true, record.dismissalId(), record.lessonIds().ids(), record.dismissedBy(),
                record.dismissedAt(),
                record.detectionMethod() != null ? record.detectionMethod().wireName() : null,
                record.notes());
    }
}
