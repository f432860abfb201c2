package com.lesson.dedup.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records audit entries for resolution operations.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditAction action, String lessonId, String actorId, Map<String, Object> details) {
        AuditEntry entry = repository.save(AuditEntry.builder()
                .action(action)
                .lessonId(lessonId)
                .actorId(actorId)
                .details(details)
                .build());
        log.debug("audit.recorded action={} lessonId={} actor={}", action, lessonId, actorId);
        return entry;
    }

    public AuditEntry record(AuditAction action, String lessonId, String actorId) {
        return record(action, lessonId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForLesson(String lessonId) {
        return repository.findByLessonId(lessonId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
