package com.lesson.dedup.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a lesson shown to a reviewer deciding on a duplicate group.
 *
 * @param contentLength  length of the extracted text, 0 when there is none
 * @param hasTableFormat whether the text contains the table extraction marker
 * @param hasSummary     whether the summary is non-blank after trimming
 * @param contentPreview first characters of the extracted text
 */
public record LessonReviewDetails(
        String lessonId,
        String title,
        String summary,
        String fileLink,
        int contentLength,
        boolean hasTableFormat,
        boolean hasSummary,
        String contentPreview,
        Map<ClassificationField, Set<String>> classifications,
        Instant lastModified
) {
    public LessonReviewDetails {
        classifications = classifications != null ? Map.copyOf(classifications) : Map.of();
    }
}
