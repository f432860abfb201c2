package com.lesson.dedup.rest.dto;

import java.util.List;

/**
 * Request DTO for a standalone metadata merge.
 */
public record MergeRequest(
        String canonicalId,
        List<String> duplicateIds
) {
    public MergeRequest {
        duplicateIds = duplicateIds != null ? duplicateIds : List.of();
    }
}
