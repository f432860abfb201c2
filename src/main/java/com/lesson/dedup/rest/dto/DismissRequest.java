package com.lesson.dedup.rest.dto;

import java.util.List;

/**
 * Request DTO for marking a group as not duplicates.
 *
 * @param detectionMethod optional wire name: same_title, embedding, both or mixed
 */
public record DismissRequest(
        List<String> lessonIds,
        String detectionMethod,
        String notes
) {
    public DismissRequest {
        lessonIds = lessonIds != null ? lessonIds : List.of();
    }
}
