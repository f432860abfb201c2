package com.lesson.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LessonRecord Tests")
class LessonRecordTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Blank classification values are dropped and empty fields removed")
        void classificationCleanup() {
            LessonRecord lesson = LessonRecord.builder()
                    .lessonId("l1")
                    .classification(ClassificationField.TAGS, "soil", " ", null, "soil")
                    .classification(ClassificationField.GRADE_LEVELS, " ")
                    .build();

            assertEquals(Set.of("soil"), lesson.classification(ClassificationField.TAGS));
            assertFalse(lesson.getClassifications().containsKey(ClassificationField.GRADE_LEVELS));
            assertTrue(lesson.classification(ClassificationField.GRADE_LEVELS).isEmpty());
        }

        @Test
        @DisplayName("A blank detail clears the field")
        void detailCleared() {
            LessonRecord lesson = LessonRecord.builder().lessonId("l1")
                    .detail(DetailField.DURATION, "30 minutes")
                    .detail(DetailField.DURATION, "  ")
                    .build();

            assertNull(lesson.detail(DetailField.DURATION));
        }

        @Test
        void lessonIdRequired() {
            assertThrows(NullPointerException.class, () -> LessonRecord.builder().build());
            assertThrows(IllegalArgumentException.class, () -> LessonRecord.builder().lessonId(" ").build());
        }

        @Test
        @DisplayName("Embedding is copied in and out")
        void embeddingIsolated() {
            float[] vector = {1, 2, 3};
            LessonRecord lesson = LessonRecord.builder().lessonId("l1").embedding(vector).build();
            vector[0] = 99;
            lesson.getEmbedding()[1] = 99;

            assertArrayEquals(new float[]{1, 2, 3}, lesson.getEmbedding());
            assertEquals(3, lesson.embeddingDimension());
        }

        @Test
        @DisplayName("toBuilder reproduces an equal record")
        void toBuilder() {
            LessonRecord lesson = LessonRecord.builder().lessonId("l1").title("Worms")
                    .classification(ClassificationField.TAGS, "soil")
                    .createdAt(CREATED)
                    .build();

            assertEquals(lesson, lesson.toBuilder().build());
        }
    }

    @Test
    @DisplayName("Last modified falls back to creation time")
    void effectiveLastModified() {
        LessonRecord lesson = LessonRecord.builder().lessonId("l1").createdAt(CREATED).build();
        assertEquals(CREATED, lesson.effectiveLastModified());

        Instant later = CREATED.plusSeconds(60);
        assertEquals(later, lesson.toBuilder().lastModified(later).build().effectiveLastModified());
    }

    @ParameterizedTest
    @EnumSource(ClassificationField.class)
    @DisplayName("Classification wire names parse back")
    void classificationWireNames(ClassificationField field) {
        assertEquals(field, ClassificationField.fromWireName(field.wireName()));
    }

    @Test
    void detectionMethodWireNames() {
        assertEquals(DetectionMethod.SAME_TITLE, DetectionMethod.fromWireName(" Same_Title "));
        assertEquals("both", DetectionMethod.BOTH.wireName());
        assertThrows(IllegalArgumentException.class, () -> DetectionMethod.fromWireName("fuzzy"));
    }
}
