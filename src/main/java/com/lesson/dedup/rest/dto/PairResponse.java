package com.lesson.dedup.rest.dto;

import com.lesson.dedup.core.model.DuplicatePair;

/**
 * Response DTO for a candidate duplicate pair.
 */
public record PairResponse(
        String id1,
        String id2,
        String title1,
        String title2,
        String detectionMethod,
        Double similarity
) {
    public static PairResponse from(DuplicatePair pair) {
        return new PairResponse(pair.lessonId1(), pair.lessonId2(), pair.title1(), pair.title2(),
                pair.matchType().wireName(), pair.similarity());
    }
}
