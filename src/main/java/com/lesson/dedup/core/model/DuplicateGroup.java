package com.lesson.dedup.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A connected component of duplicate pairs, computed at query time.
 *
 * @param avgSimilarity mean similarity over pairs that have one, or null if none do
 * @param recommendedCanonicalId highest scoring lesson of the group, null when unknown
 */
public record DuplicateGroup(
        LessonIdSet lessonIds,
        List<DuplicatePair> pairs,
        DetectionMethod detectionMethod,
        GroupConfidence confidence,
        Double avgSimilarity,
        String recommendedCanonicalId
) {
    public DuplicateGroup {
        Objects.requireNonNull(lessonIds, "lessonIds is required");
        pairs = pairs != null ? List.copyOf(pairs) : List.of();
    }

    public String groupKey() {
        return lessonIds.key();
    }

    public int pairCount() {
        return pairs.size();
    }

    public DuplicateGroup withRecommendedCanonical(String lessonId) {
        return new DuplicateGroup(lessonIds, pairs, detectionMethod, confidence, avgSimilarity, lessonId);
    }
}
