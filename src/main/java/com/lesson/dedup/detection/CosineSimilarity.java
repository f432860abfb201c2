package com.lesson.dedup.detection;

/**
 * Cosine similarity between embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Cosine similarity of two vectors of equal length.
     *
     * @return a value in [-1, 1], or {@code Double.NaN} if either vector has zero norm
     * @throws IllegalArgumentException if the lengths differ
     */
    public static double compute(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        return dot(a, b) / (norm(a) * norm(b));
    }

    /**
     * Same as {@link #compute} with norms precomputed by {@link #norm}.
     */
    static double compute(float[] a, double normA, float[] b, double normB) {
        if (normA == 0.0 || normB == 0.0) {
            return Double.NaN;
        }
        return dot(a, b) / (normA * normB);
    }

    static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
