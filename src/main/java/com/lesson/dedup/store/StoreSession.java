package com.lesson.dedup.store;

import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.core.model.ResolutionDecision;

import java.util.List;
import java.util.Optional;

/**
 * Transactional view of the content store. Reads observe the session's own writes;
 * nothing is visible to other callers until the transaction commits.
 */
public interface StoreSession {

    Optional<LessonRecord> findLesson(String lessonId);

    /**
     * Archive record of a lesson, looked up by the archived lesson's id.
     */
    Optional<ArchiveRecord> findArchive(String lessonId);

    List<DismissalRecord> findDismissals();

    /**
     * Replaces a live lesson.
     *
     * @throws StoreException if the lesson does not exist
     */
    void updateLesson(LessonRecord lesson);

    /**
     * Archives a live lesson as one step: stores the archive record, points every canonical
     * link that targets the lesson at the archive's canonical, links the lesson itself to that
     * canonical and deletes the live lesson. No reader ever sees the lesson both live and
     * archived.
     *
     * @return number of existing links that were re-pointed
     * @throws StoreException if the lesson is not live or already has an archive record
     */
    int archiveLesson(ArchiveRecord archive);

    void appendDecision(ResolutionDecision decision);

    void appendDismissal(DismissalRecord dismissal);
}
