package com.lesson.dedup.core.model;

import java.util.Objects;

/**
 * A candidate duplicate pair. Ids are ordered so that {@code lessonId1 < lessonId2},
 * and each title belongs to the id at the same position.
 *
 * @param similarity cosine similarity of the two embeddings, or null when either is missing
 */
public record DuplicatePair(
        String lessonId1,
        String lessonId2,
        String title1,
        String title2,
        Double similarity,
        DetectionMethod matchType
) {
    public DuplicatePair {
        Objects.requireNonNull(lessonId1, "lessonId1 is required");
        Objects.requireNonNull(lessonId2, "lessonId2 is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (lessonId1.compareTo(lessonId2) >= 0) {
            throw new IllegalArgumentException(
                    "Pair ids must be distinct and ordered: " + lessonId1 + ", " + lessonId2);
        }
    }

    /**
     * Creates a pair from two lessons in any order.
     */
    public static DuplicatePair of(LessonRecord a, LessonRecord b, Double similarity, DetectionMethod matchType) {
        if (a.getLessonId().compareTo(b.getLessonId()) < 0) {
            return new DuplicatePair(a.getLessonId(), b.getLessonId(), a.getTitle(), b.getTitle(),
                    similarity, matchType);
        }
        return new DuplicatePair(b.getLessonId(), a.getLessonId(), b.getTitle(), a.getTitle(),
                similarity, matchType);
    }
}
