package com.lesson.dedup.detection;

import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DuplicatePair;
import com.lesson.dedup.core.model.LessonRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds candidate duplicate pairs among live lessons.
 *
 * <p>Two lessons pair up when their normalized titles are equal, or when both carry a valid
 * embedding and the cosine similarity reaches the threshold. Lessons titled with the sentinel
 * (placeholder for a missing title) are ignored entirely. An embedding is valid when it has
 * the configured dimension, a non-zero norm and only finite components; invalid embeddings
 * are treated as absent.</p>
 *
 * <p>Output is ordered by match type (both, same_title, embedding), then similarity
 * descending with missing similarities last, then by ids.</p>
 */
public class DuplicatePairFinder {
    private static final Logger log = LoggerFactory.getLogger(DuplicatePairFinder.class);

    static final Comparator<DuplicatePair> PAIR_ORDER = Comparator
            .comparingInt((DuplicatePair p) -> p.matchType().priority())
            .thenComparing(DuplicatePair::similarity, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(DuplicatePair::lessonId1)
            .thenComparing(DuplicatePair::lessonId2);

    private final double similarityThreshold;
    private final int embeddingDimension;
    private final String sentinelTitle;

    public DuplicatePairFinder(double similarityThreshold, int embeddingDimension, String sentinelTitle) {
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in (0, 1]");
        }
        if (embeddingDimension <= 0) {
            throw new IllegalArgumentException("embeddingDimension must be > 0");
        }
        this.similarityThreshold = similarityThreshold;
        this.embeddingDimension = embeddingDimension;
        this.sentinelTitle = sentinelTitle;
    }

    public List<DuplicatePair> findPairs(List<LessonRecord> lessons) {
        List<Candidate> candidates = new ArrayList<>();
        int skippedEmbeddings = 0;
        for (LessonRecord lesson : lessons) {
            if (isSentinel(lesson.getTitle())) {
                continue;
            }
            Candidate candidate = Candidate.of(lesson, embeddingDimension);
            if (lesson.hasEmbedding() && candidate.embedding == null) {
                skippedEmbeddings++;
            }
            candidates.add(candidate);
        }
        candidates.sort(Comparator.comparing(c -> c.lesson.getLessonId()));
        if (skippedEmbeddings > 0) {
            log.debug("detection.embeddings.skipped count={} expectedDimension={}", skippedEmbeddings, embeddingDimension);
        }

        Map<String, DuplicatePair> pairs = new LinkedHashMap<>();
        findTitleMatches(candidates, pairs);
        findEmbeddingMatches(candidates, pairs);

        List<DuplicatePair> result = new ArrayList<>(pairs.values());
        result.sort(PAIR_ORDER);
        return result;
    }

    private void findTitleMatches(List<Candidate> candidates, Map<String, DuplicatePair> pairs) {
        Map<String, List<Candidate>> byTitle = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            if (!c.normalizedTitle.isEmpty()) {
                byTitle.computeIfAbsent(c.normalizedTitle, k -> new ArrayList<>()).add(c);
            }
        }
        for (List<Candidate> bucket : byTitle.values()) {
            for (int i = 0; i < bucket.size(); i++) {
                for (int j = i + 1; j < bucket.size(); j++) {
                    Candidate a = bucket.get(i);
                    Candidate b = bucket.get(j);
                    Double similarity = similarity(a, b);
                    DetectionMethod method = similarity != null && similarity >= similarityThreshold
                            ? DetectionMethod.BOTH
                            : DetectionMethod.SAME_TITLE;
                    put(pairs, DuplicatePair.of(a.lesson, b.lesson, similarity, method));
                }
            }
        }
    }

    private void findEmbeddingMatches(List<Candidate> candidates, Map<String, DuplicatePair> pairs) {
        List<Candidate> withEmbedding = candidates.stream().filter(c -> c.embedding != null).toList();
        for (int i = 0; i < withEmbedding.size(); i++) {
            for (int j = i + 1; j < withEmbedding.size(); j++) {
                Candidate a = withEmbedding.get(i);
                Candidate b = withEmbedding.get(j);
                if (!a.normalizedTitle.isEmpty() && a.normalizedTitle.equals(b.normalizedTitle)) {
                    continue;
                }
                Double similarity = similarity(a, b);
                if (similarity != null && similarity >= similarityThreshold) {
                    put(pairs, DuplicatePair.of(a.lesson, b.lesson, similarity, DetectionMethod.EMBEDDING));
                }
            }
        }
    }

    private static void put(Map<String, DuplicatePair> pairs, DuplicatePair pair) {
        pairs.putIfAbsent(pair.lessonId1() + '\u0000' + pair.lessonId2(), pair);
    }

    private static Double similarity(Candidate a, Candidate b) {
        if (a.embedding == null || b.embedding == null) {
            return null;
        }
        double value = CosineSimilarity.compute(a.embedding, a.norm, b.embedding, b.norm);
        return Double.isNaN(value) ? null : value;
    }

    private boolean isSentinel(String title) {
        return sentinelTitle != null && title != null && title.strip().equalsIgnoreCase(sentinelTitle);
    }

    private static final class Candidate {
        final LessonRecord lesson;
        final String normalizedTitle;
        final float[] embedding;
        final double norm;

        private Candidate(LessonRecord lesson, String normalizedTitle, float[] embedding, double norm) {
            this.lesson = lesson;
            this.normalizedTitle = normalizedTitle;
            this.embedding = embedding;
            this.norm = norm;
        }

        static Candidate of(LessonRecord lesson, int dimension) {
            String title = TitleNormalizer.normalize(lesson.getTitle());
            if (lesson.embeddingDimension() != dimension) {
                return new Candidate(lesson, title, null, 0.0);
            }
            float[] vector = lesson.getEmbedding();
            for (float x : vector) {
                if (!Float.isFinite(x)) {
                    return new Candidate(lesson, title, null, 0.0);
                }
            }
            double norm = CosineSimilarity.norm(vector);
            return norm == 0.0
                    ? new Candidate(lesson, title, null, 0.0)
                    : new Candidate(lesson, title, vector, norm);
        }
    }
}
