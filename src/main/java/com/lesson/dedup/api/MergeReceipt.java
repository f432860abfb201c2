package com.lesson.dedup.api;

import java.util.List;
import java.util.Map;

/**
 * Result of a standalone metadata merge.
 *
 * @param addedValues      values each set-valued field gained, by wire name
 * @param backfilledFields single-valued fields that were filled, by wire name
 */
public record MergeReceipt(
        String canonicalId,
        List<String> sourceIds,
        Map<String, List<String>> addedValues,
        Map<String, String> backfilledFields
) {
    public MergeReceipt {
        sourceIds = List.copyOf(sourceIds);
        addedValues = Map.copyOf(addedValues);
        backfilledFields = Map.copyOf(backfilledFields);
    }

    public boolean changed() {
        return !addedValues.isEmpty() || !backfilledFields.isEmpty();
    }
}
