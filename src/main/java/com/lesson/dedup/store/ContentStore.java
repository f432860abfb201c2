package com.lesson.dedup.store;

import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.CanonicalLink;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.core.model.ResolutionDecision;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage boundary for lessons, archives, resolution decisions, dismissals and canonical links.
 *
 * <p>Read methods see committed state only. All writes go through
 * {@link #inTransaction(Collection, StoreWork)}, which applies them all or none.</p>
 */
public interface ContentStore {

    /**
     * All live lessons, ordered by id.
     */
    List<LessonRecord> findAllLessons();

    /**
     * Live lessons among the given ids, ordered by id. Unknown ids are ignored.
     */
    List<LessonRecord> findLessons(Collection<String> lessonIds);

    Optional<LessonRecord> findLesson(String lessonId);

    Optional<ArchiveRecord> findArchive(String lessonId);

    /**
     * Archive records of the given archived lesson ids.
     */
    List<ArchiveRecord> findArchives(Collection<String> lessonIds);

    /**
     * Archive records whose canonical id is one of the given ids.
     */
    List<ArchiveRecord> findArchivesByCanonical(Collection<String> canonicalIds);

    /**
     * Resolution decisions whose canonical id is one of the given ids, oldest first.
     */
    List<ResolutionDecision> findDecisionsByCanonical(Collection<String> canonicalIds);

    List<DismissalRecord> findDismissals();

    Optional<CanonicalLink> findCanonicalLink(String archivedLessonId);

    /**
     * Inserts or replaces a live lesson. Entry point for the ingestion pipeline.
     */
    void saveLesson(LessonRecord lesson);

    /**
     * Runs {@code work} atomically. Lessons named in {@code lockIds} are isolated from other
     * transactions for the duration; any exception thrown by {@code work} rolls back every
     * write it made and is rethrown unchanged.
     *
     * @throws StoreException if the transaction cannot be started or committed
     */
    <T> T inTransaction(Collection<String> lockIds, StoreWork<T> work);
}
