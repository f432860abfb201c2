package com.lesson.dedup.rest.dto;

import com.lesson.dedup.core.model.DuplicateGroup;

import java.util.List;
import java.util.Locale;

/**
 * Response DTO for a duplicate group.
 */
public record GroupResponse(
        String groupKey,
        List<String> lessonIds,
        String detectionMethod,
        String confidence,
        Double avgSimilarity,
        int pairCount,
        String recommendedCanonicalId,
        List<PairResponse> pairs
) {
    public static GroupResponse from(DuplicateGroup group) {
        return new GroupResponse(
                group.groupKey(),
                group.lessonIds().ids(),
                group.detectionMethod().wireName(),
                group.confidence().name().toLowerCase(Locale.ROOT),
                group.avgSimilarity(),
                group.pairCount(),
                group.recommendedCanonicalId(),
                group.pairs().stream().map(PairResponse::from).toList());
    }
}
