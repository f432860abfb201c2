package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.GroupResolutionState;
import com.lesson.dedup.core.model.LessonIdSet;
import com.lesson.dedup.core.model.ResolutionDecision;
import com.lesson.dedup.core.model.ResolutionState;
import com.lesson.dedup.store.InMemoryContentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.lesson.dedup.LessonFixtures.lesson;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupResolutionStateChecker Tests")
class GroupResolutionStateCheckerTest {

    private static final Instant T1 = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-02T00:00:00Z");

    private InMemoryContentStore store;
    private GroupResolutionStateChecker checker;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
        for (String id : List.of("a", "b", "c", "d")) {
            store.saveLesson(lesson(id, "Lesson " + id));
        }
        checker = new GroupResolutionStateChecker(store);
    }

    private void dismiss(Instant at, String... ids) {
        store.inTransaction(List.of(ids), session -> {
            session.appendDismissal(new DismissalRecord("d-" + at, LessonIdSet.of(ids), "u1", at, null, null));
            return null;
        });
    }

    @Test
    void untouchedGroupIsNotResolved() {
        GroupResolutionState state = checker.check(LessonIdSet.of("a", "b"));

        assertEquals(ResolutionState.NOT_RESOLVED, state.state());
        assertNull(state.resolvedAt());
        assertFalse(state.isResolved());
    }

    @Test
    @DisplayName("Dismissal matches the exact set only")
    void exactSetDismissal() {
        dismiss(T1, "a", "b");

        assertEquals(GroupResolutionState.dismissed(T1), checker.check(LessonIdSet.of("b", "a")));
        assertFalse(checker.check(LessonIdSet.of("a", "b", "c")).isResolved());
        assertFalse(checker.check(LessonIdSet.of("a", "c")).isResolved());
    }

    @Test
    @DisplayName("A group whose member is canonical of a decision is archived")
    void decisionMakesArchived() {
        store.inTransaction(List.of("c"), session -> {
            session.appendDecision(ResolutionDecision.builder()
                    .canonicalId("c").archivedIds(List.of("x")).resolvedAt(T1).build());
            return null;
        });

        assertEquals(GroupResolutionState.archived(T1), checker.check(LessonIdSet.of("c", "d")));
    }

    @Test
    @DisplayName("Archived wins over dismissed and reports the latest time")
    void archivedWins() {
        dismiss(T2, "a", "b");
        store.inTransaction(List.of("a", "b"), session -> new ArchivalEngine().archive(session, "b", "a", "u1", T1));
        store.inTransaction(List.of("a"), session -> {
            session.appendDecision(ResolutionDecision.builder()
                    .canonicalId("a").archivedIds(List.of("b")).resolvedAt(T2).build());
            return null;
        });

        GroupResolutionState state = checker.check(LessonIdSet.of("a", "b"));

        assertEquals(ResolutionState.ARCHIVED, state.state());
        assertEquals(T2, state.resolvedAt());
    }

    @Test
    @DisplayName("Batch check answers every group")
    void checkAll() {
        dismiss(T1, "c", "d");
        LessonIdSet ab = LessonIdSet.of("a", "b");
        LessonIdSet cd = LessonIdSet.of("c", "d");

        Map<LessonIdSet, GroupResolutionState> states = checker.checkAll(List.of(ab, cd));

        assertFalse(states.get(ab).isResolved());
        assertEquals(ResolutionState.DISMISSED, states.get(cd).state());
    }
}
