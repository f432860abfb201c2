package com.lesson.dedup.rest.dto;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for resolving a duplicate group in one step.
 *
 * @param titleUpdates new title per lesson id, applied in the same transaction
 */
public record ResolveGroupRequest(
        String canonicalId,
        List<String> duplicateIds,
        Boolean mergeMetadata,
        String notes,
        Map<String, String> titleUpdates
) {
    public ResolveGroupRequest {
        duplicateIds = duplicateIds != null ? duplicateIds : List.of();
        mergeMetadata = mergeMetadata != null ? mergeMetadata : Boolean.TRUE;
        titleUpdates = titleUpdates != null ? titleUpdates : Map.of();
    }

    public ResolveGroupRequest(String canonicalId, List<String> duplicateIds, Boolean mergeMetadata, String notes) {
        this(canonicalId, duplicateIds, mergeMetadata, notes, null);
    }
}
