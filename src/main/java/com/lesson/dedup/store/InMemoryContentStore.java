package com.lesson.dedup.store;

import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.CanonicalLink;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.core.model.ResolutionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory content store with serializable transactions.
 *
 * <p>Writers are serialized by a single lock. Each transaction works on a private copy of
 * the committed state, which replaces the committed state only when the work returns
 * normally. Readers never block and always see the last committed state.</p>
 */
public class InMemoryContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryContentStore.class);

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final long lockTimeoutMs;
    private volatile State committed = new State();

    public InMemoryContentStore() {
        this(30_000);
    }

    public InMemoryContentStore(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public List<LessonRecord> findAllLessons() {
        return List.copyOf(committed.lessons.values());
    }

    @Override
    public List<LessonRecord> findLessons(Collection<String> lessonIds) {
        State state = committed;
        List<LessonRecord> result = new ArrayList<>();
        for (String id : new TreeSet<>(lessonIds)) {
            LessonRecord lesson = state.lessons.get(id);
            if (lesson != null) {
                result.add(lesson);
            }
        }
        return result;
    }

    @Override
    public Optional<LessonRecord> findLesson(String lessonId) {
        return Optional.ofNullable(committed.lessons.get(lessonId));
    }

    @Override
    public Optional<ArchiveRecord> findArchive(String lessonId) {
        return Optional.ofNullable(committed.archives.get(lessonId));
    }

    @Override
    public List<ArchiveRecord> findArchives(Collection<String> lessonIds) {
        State state = committed;
        List<ArchiveRecord> result = new ArrayList<>();
        for (String id : new HashSet<>(lessonIds)) {
            ArchiveRecord archive = state.archives.get(id);
            if (archive != null) {
                result.add(archive);
            }
        }
        return result;
    }

    @Override
    public List<ArchiveRecord> findArchivesByCanonical(Collection<String> canonicalIds) {
        Set<String> ids = new HashSet<>(canonicalIds);
        return committed.archives.values().stream()
                .filter(a -> ids.contains(a.canonicalId()))
                .toList();
    }

    @Override
    public List<ResolutionDecision> findDecisionsByCanonical(Collection<String> canonicalIds) {
        Set<String> ids = new HashSet<>(canonicalIds);
        return committed.decisions.stream()
                .filter(d -> ids.contains(d.canonicalId()))
                .toList();
    }

    @Override
    public List<DismissalRecord> findDismissals() {
        return List.copyOf(committed.dismissals);
    }

    @Override
    public Optional<CanonicalLink> findCanonicalLink(String archivedLessonId) {
        return Optional.ofNullable(committed.links.get(archivedLessonId));
    }

    @Override
    public void saveLesson(LessonRecord lesson) {
        acquire();
        try {
            State working = committed.copy();
            working.lessons.put(lesson.getLessonId(), lesson);
            committed = working;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public <T> T inTransaction(Collection<String> lockIds, StoreWork<T> work) {
        acquire();
        try {
            State working = committed.copy();
            T result = work.execute(new Session(working));
            committed = working;
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private void acquire() {
        try {
            if (!writeLock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new StoreException("Timed out after " + lockTimeoutMs + "ms waiting for the store write lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for the store write lock", e);
        }
    }

    private static final class State {
        final Map<String, LessonRecord> lessons;
        final Map<String, ArchiveRecord> archives;
        final List<ResolutionDecision> decisions;
        final List<DismissalRecord> dismissals;
        final Map<String, CanonicalLink> links;

        State() {
            this(new TreeMap<>(), new TreeMap<>(), new ArrayList<>(), new ArrayList<>(), new TreeMap<>());
        }

        private State(Map<String, LessonRecord> lessons, Map<String, ArchiveRecord> archives,
                      List<ResolutionDecision> decisions, List<DismissalRecord> dismissals,
                      Map<String, CanonicalLink> links) {
            this.lessons = lessons;
            this.archives = archives;
            this.decisions = decisions;
            this.dismissals = dismissals;
            this.links = links;
        }

        // Values are immutable, so copying the containers is enough.
        State copy() {
            return new State(new TreeMap<>(lessons), new TreeMap<>(archives), new ArrayList<>(decisions),
                    new ArrayList<>(dismissals), new TreeMap<>(links));
        }
    }

    private static final class Session implements StoreSession {
        private final State state;

        Session(State state) {
            this.state = state;
        }

        @Override
        public Optional<LessonRecord> findLesson(String lessonId) {
            return Optional.ofNullable(state.lessons.get(lessonId));
        }

        @Override
        public Optional<ArchiveRecord> findArchive(String lessonId) {
            return Optional.ofNullable(state.archives.get(lessonId));
        }

        @Override
        public List<DismissalRecord> findDismissals() {
            return List.copyOf(state.dismissals);
        }

        @Override
        public void updateLesson(LessonRecord lesson) {
            if (!state.lessons.containsKey(lesson.getLessonId())) {
                throw new StoreException("Cannot update missing lesson " + lesson.getLessonId());
            }
            state.lessons.put(lesson.getLessonId(), lesson);
        }

        @Override
        public int archiveLesson(ArchiveRecord archive) {
            String lessonId = archive.lessonId();
            if (!state.lessons.containsKey(lessonId)) {
                throw new StoreException("Cannot archive missing lesson " + lessonId);
            }
            if (state.archives.containsKey(lessonId)) {
                throw new StoreException("Archive record already exists for lesson " + lessonId);
            }
            state.archives.put(lessonId, archive);

            int repointed = 0;
            for (Map.Entry<String, CanonicalLink> entry : state.links.entrySet()) {
                if (entry.getValue().canonicalId().equals(lessonId)) {
                    entry.setValue(entry.getValue().withCanonical(archive.canonicalId()));
                    repointed++;
                }
            }
            if (repointed > 0) {
                log.debug("links.repointed from={} to={} count={}", lessonId, archive.canonicalId(), repointed);
            }
            state.links.put(lessonId, new CanonicalLink(lessonId, archive.canonicalId(), archive.archivedAt()));
            state.lessons.remove(lessonId);
            return repointed;
        }

        @Override
        public void appendDecision(ResolutionDecision decision) {
            state.decisions.add(decision);
        }

        @Override
        public void appendDismissal(DismissalRecord dismissal) {
            state.dismissals.add(dismissal);
        }
    }
}
