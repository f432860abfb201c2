package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.DetailField;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.store.InMemoryContentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.lesson.dedup.LessonFixtures.builder;
import static com.lesson.dedup.LessonFixtures.lesson;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetadataMergeEngine Tests")
class MetadataMergeEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final MetadataMergeEngine engine = new MetadataMergeEngine();

    private final LessonRecord canonical = builder("canon", "Garden Basics 101")
            .summary("Canonical summary")
            .classification(ClassificationField.GRADE_LEVELS, "3", "4")
            .classification(ClassificationField.TAGS, "soil")
            .detail(DetailField.DURATION, "45 minutes")
            .build();

    private final LessonRecord duplicate = builder("dup", "Garden basics 101 (copy)")
            .summary("Duplicate summary")
            .classification(ClassificationField.GRADE_LEVELS, "4", "5")
            .classification(ClassificationField.MAIN_INGREDIENTS, "kale")
            .detail(DetailField.DURATION, "60 minutes")
            .detail(DetailField.LOCATION, "Garden")
            .build();

    @Nested
    @DisplayName("Planning")
    class Planning {

        @Test
        @DisplayName("Set-valued fields become the union, canonical values first")
        void union() {
            MetadataMergeEngine.MergeOutcome outcome = engine.plan(canonical, List.of(duplicate));

            assertEquals(List.of("3", "4", "5"),
                    List.copyOf(outcome.merged().classification(ClassificationField.GRADE_LEVELS)));
            assertEquals(Set.of("kale"), outcome.merged().classification(ClassificationField.MAIN_INGREDIENTS));
            assertEquals(Set.of("soil"), outcome.merged().classification(ClassificationField.TAGS));
            assertEquals(Set.of("5"), outcome.added().get(ClassificationField.GRADE_LEVELS));
            assertFalse(outcome.added().containsKey(ClassificationField.TAGS));
        }

        @Test
        @DisplayName("Single-valued fields are only backfilled where empty")
        void backfill() {
            MetadataMergeEngine.MergeOutcome outcome = engine.plan(canonical, List.of(duplicate));

            assertEquals("45 minutes", outcome.merged().detail(DetailField.DURATION));
            assertEquals("Garden", outcome.merged().detail(DetailField.LOCATION));
            assertEquals(List.of(DetailField.LOCATION), List.copyOf(outcome.backfilled().keySet()));
        }

        @Test
        @DisplayName("First duplicate with a value wins the backfill")
        void firstDuplicateWins() {
            LessonRecord second = builder("dup2", "x").detail(DetailField.GROUP_SIZE, "large").build();
            LessonRecord first = builder("dup1", "x").detail(DetailField.GROUP_SIZE, "small").build();

            MetadataMergeEngine.MergeOutcome outcome = engine.plan(canonical, List.of(first, second));

            assertEquals("small", outcome.merged().detail(DetailField.GROUP_SIZE));
        }

        @Test
        @DisplayName("Title and summary are never touched")
        void identityUntouched() {
            LessonRecord merged = engine.plan(canonical, List.of(duplicate)).merged();

            assertEquals("Garden Basics 101", merged.getTitle());
            assertEquals("Canonical summary", merged.getSummary());
        }

        @Test
        void mergedValuesUseWireNames() {
            MetadataMergeEngine.MergeOutcome outcome = engine.plan(canonical, List.of(duplicate));

            assertEquals(List.of("3", "4", "5"), outcome.mergedValues().get("grade_levels"));
        }
    }

    @Nested
    @DisplayName("Applying")
    class Applying {

        @Test
        @DisplayName("Merge writes the canonical and a second merge is a no-op")
        void idempotent() {
            InMemoryContentStore store = new InMemoryContentStore();
            store.saveLesson(canonical);
            store.saveLesson(duplicate);

            MetadataMergeEngine.MergeOutcome first = store.inTransaction(List.of("canon", "dup"),
                    session -> engine.mergeInto(session, "canon", List.of("dup"), NOW));
            LessonRecord afterFirst = store.findLesson("canon").orElseThrow();
            MetadataMergeEngine.MergeOutcome second = store.inTransaction(List.of("canon", "dup"),
                    session -> engine.mergeInto(session, "canon", List.of("dup"), NOW.plusSeconds(60)));

            assertTrue(first.changed());
            assertEquals(NOW, afterFirst.getUpdatedAt());
            assertFalse(second.changed());
            assertEquals(afterFirst, store.findLesson("canon").orElseThrow());
            assertTrue(store.findLesson("dup").isPresent());
        }

        @Test
        void missingDuplicateIsNotFound() {
            InMemoryContentStore store = new InMemoryContentStore();
            store.saveLesson(canonical);

            ResolutionException e = assertThrows(ResolutionException.class, () -> store.inTransaction(List.of("canon"),
                    session -> engine.mergeInto(session, "canon", List.of("ghost"), NOW)));
            assertEquals(ErrorCategory.NOT_FOUND, e.getCategory());
        }

        @Test
        void canonicalAmongDuplicatesIsInvalid() {
            InMemoryContentStore store = new InMemoryContentStore();
            store.saveLesson(canonical);
            store.saveLesson(lesson("other", "x"));

            ResolutionException e = assertThrows(ResolutionException.class, () -> store.inTransaction(List.of("canon"),
                    session -> engine.mergeInto(session, "canon", List.of("other", "canon"), NOW)));
            assertEquals(ErrorCategory.INVALID_ARGUMENT, e.getCategory());
        }
    }
}
