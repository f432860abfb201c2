package com.lesson.dedup.rest.dto;

import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.LessonReviewDetails;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response DTO with the details a reviewer compares across a group.
 *
 * @param gradeLevels grade levels, repeated at the top level because reviewers compare them first
 */
public record LessonDetailsResponse(
        String id,
        String title,
        String summary,
        int contentLength,
        List<String> gradeLevels,
        boolean hasTableFormatArtifact,
        boolean hasSummary,
        String link,
        String contentPreview,
        Map<String, List<String>> classifications,
        Instant lastModified
) {
    public static LessonDetailsResponse from(LessonReviewDetails details) {
        Map<String, List<String>> classifications = new TreeMap<>();
        details.classifications().forEach((field, values) -> classifications.put(field.wireName(), List.copyOf(values)));
        List<String> gradeLevels = classifications.getOrDefault(ClassificationField.GRADE_LEVELS.wireName(), List.of());
        return new LessonDetailsResponse(details.lessonId(), details.title(), details.summary(),
                details.contentLength(), gradeLevels, details.hasTableFormat(), details.hasSummary(),
                details.fileLink(), details.contentPreview(), classifications, details.lastModified());
    }
}
