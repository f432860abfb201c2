package com.lesson.dedup.api;

import java.util.List;
import java.util.Map;

/**
 * Result of resolving a duplicate group in one transaction.
 *
 * @param mergedValues canonical's set-valued fields after the merge, empty when no merge was requested
 * @param titleUpdates titles requested per lesson id, empty when none were
 */
public record GroupResolutionReceipt(
        String canonicalId,
        List<String> archivedIds,
        List<String> archiveIds,
        boolean metadataMerged,
        Map<String, List<String>> mergedValues,
        Map<String, String> titleUpdates,
        String decisionId
) {
    public GroupResolutionReceipt {
        archivedIds = List.copyOf(archivedIds);
        archiveIds = List.copyOf(archiveIds);
        mergedValues = mergedValues != null ? Map.copyOf(mergedValues) : Map.of();
        titleUpdates = titleUpdates != null ? Map.copyOf(titleUpdates) : Map.of();
    }
}
