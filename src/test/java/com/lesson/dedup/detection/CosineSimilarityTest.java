package com.lesson.dedup.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CosineSimilarity Tests")
class CosineSimilarityTest {

    @Test
    @DisplayName("Identical direction scores 1 regardless of magnitude")
    void sameDirection() {
        assertEquals(1.0, CosineSimilarity.compute(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-9);
    }

    @Test
    @DisplayName("Orthogonal vectors score 0 and opposite vectors -1")
    void orthogonalAndOpposite() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(-1.0, CosineSimilarity.compute(new float[]{1, 0}, new float[]{-1, 0}), 1e-9);
    }

    @Test
    @DisplayName("Zero vector gives NaN")
    void zeroVector() {
        assertTrue(Double.isNaN(CosineSimilarity.compute(new float[]{0, 0}, new float[]{1, 0})));
    }

    @Test
    @DisplayName("Different lengths are rejected")
    void dimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> CosineSimilarity.compute(new float[]{1, 0}, new float[]{1, 0, 0}));
    }
}
