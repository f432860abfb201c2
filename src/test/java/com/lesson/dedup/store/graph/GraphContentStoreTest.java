package com.lesson.dedup.store.graph;

import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.core.model.ResolutionDecision;
import com.lesson.dedup.lock.DistributedLock;
import com.lesson.dedup.resolution.ArchivalEngine;
import com.lesson.dedup.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.lesson.dedup.LessonFixtures.lesson;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("GraphContentStore Tests")
class GraphContentStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String ARCHIVE_QUERY = "DETACH DELETE l";

    private final LessonNodeMapper mapper = new LessonNodeMapper();
    private final LessonRecord dup = lesson("dup", "Garden Basics 101", 1f, 0f, 0f);
    private final LessonRecord canon = lesson("canon", "Garden Basics 101");

    private GraphConnection connection;
    private DistributedLock lock;
    private GraphContentStore store;

    @BeforeEach
    void setUp() {
        connection = mock(GraphConnection.class);
        lock = mock(DistributedLock.class);
        when(lock.tryLock(anyString())).thenReturn(true);
        when(connection.getGraphName()).thenReturn("lessons");
        store = new GraphContentStore(connection, lock, mapper);
    }

    private void givenLesson(LessonRecord lesson) {
        when(connection.query(contains("MATCH (l:Lesson {lessonId: $lessonId})"),
                eq(Map.of("lessonId", lesson.getLessonId()))))
                .thenReturn(List.of(mapper.toProperties(lesson)));
    }

    private void givenArchiveQuerySucceeds() {
        when(connection.query(contains(ARCHIVE_QUERY), anyMap())).thenReturn(List.of(Map.of("repointed", 0L)));
    }

    private ResolutionDecision decision() {
        return ResolutionDecision.builder()
                .canonicalId("canon")
                .archivedIds(List.of("dup"))
                .resolvedBy("u1")
                .resolvedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Rows are mapped back to lessons")
    void readsLessons() {
        when(connection.query(contains("MATCH (l:Lesson) RETURN"), anyMap()))
                .thenReturn(List.of(mapper.toProperties(canon), mapper.toProperties(dup)));

        assertEquals(List.of(canon, dup), store.findAllLessons());
    }

    @Test
    @DisplayName("Driver failures surface as store failures")
    void wrapsDriverErrors() {
        when(connection.query(contains("MATCH (l:Lesson) RETURN"), anyMap()))
                .thenThrow(new IllegalStateException("connection reset"));

        StoreException e = assertThrows(StoreException.class, () -> store.findAllLessons());
        assertEquals("connection reset", e.getCause().getMessage());
    }

    @Test
    @DisplayName("Transactions lock every named lesson and release them afterwards")
    void locksLessons() {
        store.inTransaction(List.of("dup", "canon"), session -> null);

        InOrder order = inOrder(lock);
        order.verify(lock).tryLock("lesson:canon");
        order.verify(lock).tryLock("lesson:dup");
        order.verify(lock).unlock("lesson:dup");
        order.verify(lock).unlock("lesson:canon");
    }

    @Test
    @DisplayName("Snapshot, link changes and delete go to the graph as one query")
    void archiveIsSingleQuery() {
        givenLesson(dup);
        givenLesson(canon);
        givenArchiveQuerySucceeds();

        store.inTransaction(List.of("dup", "canon"),
                session -> new ArchivalEngine().archive(session, "dup", "canon", "u1", NOW));

        verify(connection).query(argThat(q -> q.contains("CREATE (:LessonArchive")
                        && q.contains("MERGE (k:CanonicalLink")
                        && q.contains("FOREACH")
                        && q.contains(ARCHIVE_QUERY)),
                argThat(params -> "dup".equals(params.get("lessonId"))
                        && "canon".equals(params.get("canonicalId"))
                        && "u1".equals(params.get("archivedBy"))));
        verify(connection, never()).execute(anyString(), anyMap());
    }

    @Test
    @DisplayName("A lesson that disappears under the archive query fails without compensation")
    void vanishedLesson() {
        givenLesson(dup);
        givenLesson(canon);
        when(connection.query(contains(ARCHIVE_QUERY), anyMap())).thenReturn(List.of());

        assertThrows(StoreException.class, () -> store.inTransaction(List.of("dup", "canon"),
                session -> new ArchivalEngine().archive(session, "dup", "canon", "u1", NOW)));

        verify(connection, never()).execute(anyString(), anyMap());
    }

    @Test
    @DisplayName("A failure after archival recreates the lesson, then removes its link, then the snapshot")
    void compensatesArchiveAfterLaterFailure() {
        givenLesson(dup);
        givenLesson(canon);
        givenArchiveQuerySucceeds();
        when(connection.query(contains("MATCH (c:CanonicalLink {canonicalId: $lessonId}) RETURN"),
                eq(Map.of("lessonId", "dup"))))
                .thenReturn(List.of(Map.of("archivedLessonId", "older")));
        doThrow(new IllegalStateException("write timeout"))
                .when(connection).execute(contains("CREATE (:ResolutionDecision"), anyMap());

        assertThrows(StoreException.class, () -> store.inTransaction(List.of("dup", "canon"), session -> {
            new ArchivalEngine().archive(session, "dup", "canon", "u1", NOW);
            session.appendDecision(decision());
            return null;
        }));

        InOrder order = inOrder(connection);
        order.verify(connection).query(contains(ARCHIVE_QUERY), anyMap());
        order.verify(connection).execute(contains("CREATE (:ResolutionDecision"), anyMap());
        order.verify(connection).execute(contains("CREATE (l:Lesson {lessonId: $lessonId}) SET"),
                eq(mapper.toProperties(dup)));
        order.verify(connection).execute(contains("MATCH (c:CanonicalLink {archivedLessonId: $lessonId}) DELETE c"),
                eq(Map.of("lessonId", "dup")));
        order.verify(connection).execute(contains("SET c.canonicalId = $lessonId"),
                eq(Map.of("archivedLessonIds", List.of("older"), "lessonId", "dup")));
        order.verify(connection).execute(contains("MATCH (a:LessonArchive {archiveId: $archiveId}) DELETE a"), anyMap());
        verify(connection, never()).execute(contains("MATCH (d:ResolutionDecision"), anyMap());
    }

    @Test
    @DisplayName("A lesson that already has an archive record is rejected before any write")
    void existingArchiveRejected() {
        givenLesson(dup);
        when(connection.query(contains("MATCH (a:LessonArchive {lessonId: $lessonId})"), eq(Map.of("lessonId", "dup"))))
                .thenReturn(List.of(Map.of(
                        "archiveId", "arch-1",
                        "lessonId", "dup",
                        "snapshot", mapper.toSnapshot(dup),
                        "archivedBy", "u1",
                        "archivedAt", NOW.toString(),
                        "archiveReason", "duplicate_resolution",
                        "canonicalId", "canon")));

        assertThrows(StoreException.class, () -> store.inTransaction(List.of("dup"),
                session -> session.archiveLesson(ArchiveRecord.of(dup, "canon", "u1", "duplicate_resolution", NOW))));

        verify(connection, never()).query(contains(ARCHIVE_QUERY), anyMap());
    }
}
