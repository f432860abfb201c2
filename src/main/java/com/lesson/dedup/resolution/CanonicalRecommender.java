package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.LessonRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Suggests which lesson of a duplicate group should stay canonical.
 *
 * <p>Score = 0.10 x recency + 0.15 x completeness + 0.05 x grade coverage, where recency
 * decays linearly to zero over ten years since last modification, completeness is the share
 * of key classification fields that are filled, and grade coverage is the number of grade
 * levels out of eleven. Ties go to higher completeness, then the most recently modified
 * lesson, then the lexicographically smallest id.</p>
 */
public class CanonicalRecommender {

    static final double RECENCY_WEIGHT = 0.10;
    static final double COMPLETENESS_WEIGHT = 0.15;
    static final double GRADE_WEIGHT = 0.05;
    static final int MAX_GRADES = 11;
    private static final double DECAY_YEARS = 10.0;

    static final List<ClassificationField> COMPLETENESS_FIELDS = List.of(
            ClassificationField.THEMATIC_CATEGORIES,
            ClassificationField.SEASON_TIMING,
            ClassificationField.CULTURAL_HERITAGE,
            ClassificationField.ACTIVITY_TYPE,
            ClassificationField.MAIN_INGREDIENTS,
            ClassificationField.GRADE_LEVELS);

    private final Clock clock;

    public CanonicalRecommender() {
        this(Clock.systemUTC());
    }

    public CanonicalRecommender(Clock clock) {
        this.clock = clock;
    }

    /**
     * Score breakdown for one lesson.
     */
    public record CanonicalScore(String lessonId, double total, double recency, double completeness,
                                 double gradeCoverage, Instant lastModified) {
    }

    public CanonicalScore score(LessonRecord lesson) {
        Instant now = clock.instant();
        Instant modified = lesson.effectiveLastModified();
        double ageYears = Duration.between(modified, now).toMillis() / (1000.0 * 60 * 60 * 24 * 365);
        double recency = Math.min(1.0, Math.max(0.0, 1.0 - ageYears / DECAY_YEARS));

        long filled = COMPLETENESS_FIELDS.stream()
                .filter(field -> !lesson.classification(field).isEmpty())
                .count();
        double completeness = (double) filled / COMPLETENESS_FIELDS.size();

        double gradeCoverage = Math.min(1.0,
                (double) lesson.classification(ClassificationField.GRADE_LEVELS).size() / MAX_GRADES);

        double total = RECENCY_WEIGHT * recency + COMPLETENESS_WEIGHT * completeness + GRADE_WEIGHT * gradeCoverage;
        return new CanonicalScore(lesson.getLessonId(), total, recency, completeness, gradeCoverage, modified);
    }

    /**
     * Best canonical among the lessons, empty for an empty input.
     */
    public Optional<String> recommend(Collection<LessonRecord> lessons) {
        return lessons.stream()
                .map(this::score)
                .min(Comparator.comparingDouble(CanonicalScore::total).reversed()
                        .thenComparing(Comparator.comparingDouble(CanonicalScore::completeness).reversed())
                        .thenComparing(CanonicalScore::lastModified, Comparator.reverseOrder())
                        .thenComparing(CanonicalScore::lessonId))
                .map(CanonicalScore::lessonId);
    }
}
