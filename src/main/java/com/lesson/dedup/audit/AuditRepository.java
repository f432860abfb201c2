package com.lesson.dedup.audit;

import java.util.List;

/**
 * Append-only storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByLessonId(String lessonId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByActorId(String actorId);

    int count();

    /**
     * Most recent entries, oldest first, at most {@code limit}.
     */
    List<AuditEntry> findRecent(int limit);
}
