package com.lesson.dedup.chaos;

import com.lesson.dedup.api.ArchiveReceipt;
import com.lesson.dedup.api.DuplicateOptions;
import com.lesson.dedup.api.DuplicateResolver;
import com.lesson.dedup.api.GroupResolutionReceipt;
import com.lesson.dedup.audit.AuditAction;
import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.resolution.ErrorCategory;
import com.lesson.dedup.resolution.OperationResult;
import com.lesson.dedup.resolution.ResolutionException;
import com.lesson.dedup.security.Caller;
import com.lesson.dedup.security.InMemoryRoleProvider;
import com.lesson.dedup.security.ProfileRole;
import com.lesson.dedup.store.InMemoryContentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lesson.dedup.LessonFixtures.builder;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Chaos Tests")
class ChaosTest {

    private static final Caller ADMIN = Caller.user("admin-1");

    private FaultInjectingContentStore store;
    private DuplicateResolver resolver;

    @BeforeEach
    void setUp() {
        store = new FaultInjectingContentStore(new InMemoryContentStore());
        resolver = DuplicateResolver.builder()
                .contentStore(store)
                .roleProvider(new InMemoryRoleProvider().assign("admin-1", ProfileRole.ADMIN))
                .options(DuplicateOptions.builder().embeddingDimension(3).build())
                .build();
        store.saveLesson(builder("keep", "Worm Bins")
                .classification(ClassificationField.TAGS, "compost")
                .build());
        store.saveLesson(builder("dup", "worm bins")
                .embedding(new float[]{0.1f, 0.2f, 0.3f})
                .classification(ClassificationField.TAGS, "worms")
                .build());
    }

    @Test
    @DisplayName("A failure right after archival leaves the lesson untouched and no archive")
    void archiveAtomicity() {
        LessonRecord before = store.findLesson("dup").orElseThrow();
        store.setFailAfterArchive(true);

        OperationResult<ArchiveReceipt> failed = resolver.archiveDuplicateLesson(ADMIN, "dup", "keep");

        assertEquals(ErrorCategory.STORAGE_FAILURE, failed.category());
        assertEquals("Storage operation failed; no changes were applied", failed.message());
        assertEquals(1, store.getInjectedFailures());
        assertEquals(before, store.findLesson("dup").orElseThrow());
        assertTrue(store.findArchive("dup").isEmpty());
        assertTrue(store.findCanonicalLink("dup").isEmpty());
        assertTrue(store.findDecisionsByCanonical(List.of("keep")).isEmpty());
        assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.OPERATION_FAILED).size());
        assertTrue(resolver.getAuditService().getEntriesByAction(AuditAction.LESSON_ARCHIVED).isEmpty());
    }

    @Test
    @DisplayName("A retry after the fault clears archives exactly once")
    void retryAfterFault() {
        store.setFailAfterArchive(true);
        resolver.archiveDuplicateLesson(ADMIN, "dup", "keep");
        store.reset();

        OperationResult<ArchiveReceipt> retried = resolver.archiveDuplicateLesson(ADMIN, "dup", "keep");

        assertTrue(retried.isSuccess());
        assertEquals(1, store.findArchivesByCanonical(List.of("keep")).size());
        assertTrue(store.findLesson("dup").isEmpty());
    }

    @Test
    @DisplayName("A failure after the archive but before the decision also rolls back the archive")
    void decisionFailure() {
        store.setFailOnDecision(true);

        OperationResult<ArchiveReceipt> failed = resolver.archiveDuplicateLesson(ADMIN, "dup", "keep");

        assertEquals(ErrorCategory.STORAGE_FAILURE, failed.category());
        assertTrue(store.findLesson("dup").isPresent());
        assertTrue(store.findArchive("dup").isEmpty());
    }

    @Test
    @DisplayName("A failed group resolution undoes the metadata merge too")
    void groupMergeRolledBack() {
        LessonRecord canonical = store.findLesson("keep").orElseThrow();
        store.setFailAfterArchive(true);

        OperationResult<GroupResolutionReceipt> failed =
                resolver.resolveGroup(ADMIN, "keep", List.of("dup"), true, null);

        assertEquals(ErrorCategory.STORAGE_FAILURE, failed.category());
        assertEquals(canonical, store.findLesson("keep").orElseThrow());
        assertTrue(store.findLesson("dup").isPresent());
    }

    @Test
    @DisplayName("Read failures surface as storage failures")
    void readFailure() {
        store.setFailOnRead(true);

        ResolutionException e = assertThrows(ResolutionException.class, () -> resolver.findDuplicatePairs(ADMIN));

        assertEquals(ErrorCategory.STORAGE_FAILURE, e.getCategory());
    }
}
