package com.lesson.dedup.store.graph;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.CanonicalLink;
import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.LessonIdSet;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.core.model.ResolutionDecision;
import com.lesson.dedup.lock.DistributedLock;
import com.lesson.dedup.lock.LockAcquisitionException;
import com.lesson.dedup.lock.LockSet;
import com.lesson.dedup.store.CompensatingTransaction;
import com.lesson.dedup.store.ContentStore;
import com.lesson.dedup.store.StoreException;
import com.lesson.dedup.store.StoreSession;
import com.lesson.dedup.store.StoreWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Content store backed by a FalkorDB graph.
 *
 * <p>FalkorDB runs each query atomically but has no multi-query transaction. A transaction
 * here therefore locks the lessons it names, applies each write immediately and records its
 * inverse in a {@link CompensatingTransaction}; if the work fails the inverses run in reverse
 * order. Archival is a single query, so readers never see a lesson both live and archived.
 * Undoing it recreates the live lesson first, so a failed rollback never loses the lesson.</p>
 */
public class GraphContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(GraphContentStore.class);

    private static final String LESSON_COLUMNS = LessonNodeMapper.PROPERTIES.stream()
            .map(p -> "l." + p + " AS " + p)
            .collect(Collectors.joining(", "));

    private static final String LESSON_SET = LessonNodeMapper.PROPERTIES.stream()
            .filter(p -> !p.equals("lessonId"))
            .map(p -> "l." + p + " = $" + p)
            .collect(Collectors.joining(", "));

    private static final String ARCHIVE_COLUMNS = """
            a.archiveId AS archiveId, a.lessonId AS lessonId, a.snapshot AS snapshot, a.archivedBy AS archivedBy,
            a.archivedAt AS archivedAt, a.archiveReason AS archiveReason, a.canonicalId AS canonicalId""";

    private static final String DECISION_COLUMNS = """
            d.decisionId AS decisionId, d.canonicalId AS canonicalId, d.archivedIds AS archivedIds,
            d.detectionMethod AS detectionMethod, d.metadataMerged AS metadataMerged, d.mergedValues AS mergedValues,
            d.resolvedBy AS resolvedBy, d.resolvedAt AS resolvedAt, d.notes AS notes""";

    private static final String DISMISSAL_COLUMNS = """
            g.dismissalId AS dismissalId, g.lessonIds AS lessonIds, g.dismissedBy AS dismissedBy,
            g.dismissedAt AS dismissedAt, g.detectionMethod AS detectionMethod, g.notes AS notes""";

    // One query, so FalkorDB applies the snapshot, link changes and delete atomically.
    private static final String ARCHIVE_LESSON = """
            MATCH (l:Lesson {lessonId: $lessonId})
            OPTIONAL MATCH (c:CanonicalLink {canonicalId: $lessonId})
            WITH l, collect(c) AS links
            FOREACH (c IN links | SET c.canonicalId = $canonicalId)
            CREATE (:LessonArchive {archiveId: $archiveId, lessonId: $lessonId, snapshot: $snapshot,
                archivedBy: $archivedBy, archivedAt: $archivedAt, archiveReason: $archiveReason,
                canonicalId: $canonicalId})
            MERGE (k:CanonicalLink {archivedLessonId: $lessonId})
            SET k.canonicalId = $canonicalId, k.linkedAt = $archivedAt
            DETACH DELETE l
            RETURN size(links) AS repointed
            """;

    private static final TypeReference<Map<String, List<String>>> MERGED_VALUES = new TypeReference<>() {};

    private final GraphConnection connection;
    private final DistributedLock lock;
    private final LessonNodeMapper mapper;

    public GraphContentStore(GraphConnection connection, DistributedLock lock) {
        this(connection, lock, new LessonNodeMapper());
    }

    public GraphContentStore(GraphConnection connection, DistributedLock lock, LessonNodeMapper mapper) {
        this.connection = connection;
        this.lock = lock;
        this.mapper = mapper;
    }

    // ---------------------------------------------------------------- reads

    @Override
    public List<LessonRecord> findAllLessons() {
        return query("MATCH (l:Lesson) RETURN " + LESSON_COLUMNS + " ORDER BY l.lessonId", Map.of())
                .stream().map(mapper::fromProperties).toList();
    }

    @Override
    public List<LessonRecord> findLessons(Collection<String> lessonIds) {
        if (lessonIds.isEmpty()) {
            return List.of();
        }
        return query("MATCH (l:Lesson) WHERE l.lessonId IN $lessonIds RETURN " + LESSON_COLUMNS
                        + " ORDER BY l.lessonId",
                Map.of("lessonIds", List.copyOf(lessonIds)))
                .stream().map(mapper::fromProperties).toList();
    }

    @Override
    public Optional<LessonRecord> findLesson(String lessonId) {
        return query("MATCH (l:Lesson {lessonId: $lessonId}) RETURN " + LESSON_COLUMNS,
                Map.of("lessonId", lessonId))
                .stream().findFirst().map(mapper::fromProperties);
    }

    @Override
    public Optional<ArchiveRecord> findArchive(String lessonId) {
        return query("MATCH (a:LessonArchive {lessonId: $lessonId}) RETURN " + ARCHIVE_COLUMNS,
                Map.of("lessonId", lessonId))
                .stream().findFirst().map(this::toArchive);
    }

    @Override
    public List<ArchiveRecord> findArchives(Collection<String> lessonIds) {
        if (lessonIds.isEmpty()) {
            return List.of();
        }
        return query("MATCH (a:LessonArchive) WHERE a.lessonId IN $lessonIds RETURN " + ARCHIVE_COLUMNS,
                Map.of("lessonIds", List.copyOf(lessonIds)))
                .stream().map(this::toArchive).toList();
    }

    @Override
    public List<ArchiveRecord> findArchivesByCanonical(Collection<String> canonicalIds) {
        if (canonicalIds.isEmpty()) {
            return List.of();
        }
        return query("MATCH (a:LessonArchive) WHERE a.canonicalId IN $canonicalIds RETURN " + ARCHIVE_COLUMNS,
                Map.of("canonicalIds", List.copyOf(canonicalIds)))
                .stream().map(this::toArchive).toList();
    }

    @Override
    public List<ResolutionDecision> findDecisionsByCanonical(Collection<String> canonicalIds) {
        if (canonicalIds.isEmpty()) {
            return List.of();
        }
        return query("MATCH (d:ResolutionDecision) WHERE d.canonicalId IN $canonicalIds RETURN "
                        + DECISION_COLUMNS + " ORDER BY d.resolvedAt",
                Map.of("canonicalIds", List.copyOf(canonicalIds)))
                .stream().map(this::toDecision).toList();
    }

    @Override
    public List<DismissalRecord> findDismissals() {
        return query("MATCH (g:GroupDismissal) RETURN " + DISMISSAL_COLUMNS + " ORDER BY g.dismissedAt", Map.of())
                .stream().map(this::toDismissal).toList();
    }

    @Override
    public Optional<CanonicalLink> findCanonicalLink(String archivedLessonId) {
        return query("""
                        MATCH (c:CanonicalLink {archivedLessonId: $archivedLessonId})
                        RETURN c.archivedLessonId AS archivedLessonId, c.canonicalId AS canonicalId, c.linkedAt AS linkedAt
                        """,
                Map.of("archivedLessonId", archivedLessonId))
                .stream().findFirst()
                .map(row -> new CanonicalLink(
                        LessonNodeMapper.string(row, "archivedLessonId"),
                        LessonNodeMapper.string(row, "canonicalId"),
                        LessonNodeMapper.instant(row, "linkedAt")));
    }

    // ---------------------------------------------------------------- writes

    @Override
    public void saveLesson(LessonRecord lesson) {
        try (LockSet ignored = LockSet.acquire(lock, List.of(lesson.getLessonId()))) {
            execute("MERGE (l:Lesson {lessonId: $lessonId}) SET " + LESSON_SET, mapper.toProperties(lesson));
        } catch (LockAcquisitionException e) {
            throw new StoreException("Lesson " + lesson.getLessonId() + " is locked by another operation", e);
        }
    }

    @Override
    public <T> T inTransaction(Collection<String> lockIds, StoreWork<T> work) {
        try (LockSet ignored = LockSet.acquire(lock, lockIds);
             CompensatingTransaction tx = new CompensatingTransaction("graph:" + connection.getGraphName())) {
            T result = work.execute(new GraphSession(tx));
            tx.commit();
            return result;
        } catch (LockAcquisitionException e) {
            throw new StoreException("Lessons " + lockIds + " are locked by another operation", e);
        }
    }

    private void execute(String query, Map<String, Object> params) {
        try {
            connection.execute(query, params);
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Graph write failed", e);
        }
    }

    private List<Map<String, Object>> query(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Graph query failed", e);
        }
    }

    // ---------------------------------------------------------------- row mapping

    private ArchiveRecord toArchive(Map<String, Object> row) {
        return new ArchiveRecord(
                LessonNodeMapper.string(row, "archiveId"),
                mapper.fromSnapshot(LessonNodeMapper.string(row, "snapshot")),
                LessonNodeMapper.string(row, "archivedBy"),
                LessonNodeMapper.instant(row, "archivedAt"),
                LessonNodeMapper.string(row, "archiveReason"),
                LessonNodeMapper.string(row, "canonicalId"));
    }

    private ResolutionDecision toDecision(Map<String, Object> row) {
        String method = LessonNodeMapper.string(row, "detectionMethod");
        String merged = LessonNodeMapper.string(row, "mergedValues");
        return ResolutionDecision.builder()
                .decisionId(LessonNodeMapper.string(row, "decisionId"))
                .canonicalId(LessonNodeMapper.string(row, "canonicalId"))
                .archivedIds(mapper.readStringList(LessonNodeMapper.string(row, "archivedIds")))
                .detectionMethod(method != null ? DetectionMethod.fromWireName(method) : null)
                .metadataMerged(Boolean.parseBoolean(LessonNodeMapper.string(row, "metadataMerged")))
                .mergedValues(merged != null ? mapper.readJson(merged, MERGED_VALUES) : Map.of())
                .resolvedBy(LessonNodeMapper.string(row, "resolvedBy"))
                .resolvedAt(LessonNodeMapper.instant(row, "resolvedAt"))
                .notes(LessonNodeMapper.string(row, "notes"))
                .build();
    }

    private DismissalRecord toDismissal(Map<String, Object> row) {
        String method = LessonNodeMapper.string(row, "detectionMethod");
        return new DismissalRecord(
                LessonNodeMapper.string(row, "dismissalId"),
                LessonIdSet.of(mapper.readStringList(LessonNodeMapper.string(row, "lessonIds"))),
                LessonNodeMapper.string(row, "dismissedBy"),
                LessonNodeMapper.instant(row, "dismissedAt"),
                method != null ? DetectionMethod.fromWireName(method) : null,
                LessonNodeMapper.string(row, "notes"));
    }

    /**
     * Session whose writes go straight to the graph, each paired with its inverse.
     */
    private final class GraphSession implements StoreSession {
        private final CompensatingTransaction tx;

        GraphSession(CompensatingTransaction tx) {
            this.tx = tx;
        }

        @Override
        public Optional<LessonRecord> findLesson(String lessonId) {
            return GraphContentStore.this.findLesson(lessonId);
        }

        @Override
        public Optional<ArchiveRecord> findArchive(String lessonId) {
            return GraphContentStore.this.findArchive(lessonId);
        }

        @Override
        public List<DismissalRecord> findDismissals() {
            return GraphContentStore.this.findDismissals();
        }

        @Override
        public void updateLesson(LessonRecord lesson) {
            LessonRecord previous = findLesson(lesson.getLessonId())
                    .orElseThrow(() -> new StoreException("Cannot update missing lesson " + lesson.getLessonId()));
            tx.apply("update lesson " + lesson.getLessonId(),
                    () -> writeLesson(lesson),
                    () -> writeLesson(previous));
        }

        @Override
        public int archiveLesson(ArchiveRecord archive) {
            String lessonId = archive.lessonId();
            LessonRecord previous = findLesson(lessonId)
                    .orElseThrow(() -> new StoreException("Cannot archive missing lesson " + lessonId));
            if (findArchive(lessonId).isPresent()) {
                throw new StoreException("Archive record already exists for lesson " + lessonId);
            }
            List<String> repointed = new ArrayList<>();
            for (Map<String, Object> row : query(
                    "MATCH (c:CanonicalLink {canonicalId: $lessonId}) RETURN c.archivedLessonId AS archivedLessonId",
                    Map.of("lessonId", lessonId))) {
                repointed.add(LessonNodeMapper.string(row, "archivedLessonId"));
            }

            Map<String, Object> params = new HashMap<>();
            params.put("archiveId", archive.archiveId());
            params.put("lessonId", lessonId);
            params.put("snapshot", mapper.toSnapshot(archive.snapshot()));
            params.put("archivedBy", archive.archivedBy());
            params.put("archivedAt", archive.archivedAt().toString());
            params.put("archiveReason", archive.archiveReason());
            params.put("canonicalId", archive.canonicalId());
            tx.apply("archive lesson " + lessonId,
                    () -> {
                        if (query(ARCHIVE_LESSON, params).isEmpty()) {
                            throw new StoreException("Lesson " + lessonId + " vanished before archival");
                        }
                    },
                    () -> restoreArchived(archive, previous, repointed));
            log.debug("lesson.archived lessonId={} canonicalId={} repointedLinks={}",
                    lessonId, archive.canonicalId(), repointed.size());
            return repointed.size();
        }

        @Override
        public void appendDecision(ResolutionDecision decision) {
            Map<String, Object> params = new HashMap<>();
            params.put("decisionId", decision.decisionId());
            params.put("canonicalId", decision.canonicalId());
            params.put("archivedIds", mapper.writeStringList(decision.archivedIds()));
            params.put("detectionMethod", decision.detectionMethod() != null ? decision.detectionMethod().wireName() : null);
            params.put("metadataMerged", decision.metadataMerged());
            params.put("mergedValues", mapper.writeJson(decision.mergedValues()));
            params.put("resolvedBy", decision.resolvedBy());
            params.put("resolvedAt", decision.resolvedAt().toString());
            params.put("notes", decision.notes());
            tx.apply("append decision " + decision.decisionId(),
                    () -> execute("""
                            CREATE (:ResolutionDecision {decisionId: $decisionId, canonicalId: $canonicalId,
                                archivedIds: $archivedIds, detectionMethod: $detectionMethod,
                                metadataMerged: $metadataMerged, mergedValues: $mergedValues,
                                resolvedBy: $resolvedBy, resolvedAt: $resolvedAt, notes: $notes})
                            """, params),
                    () -> execute("MATCH (d:ResolutionDecision {decisionId: $decisionId}) DELETE d",
                            Map.of("decisionId", decision.decisionId())));
        }

        @Override
        public void appendDismissal(DismissalRecord dismissal) {
            Map<String, Object> params = new HashMap<>();
            params.put("dismissalId", dismissal.dismissalId());
            params.put("lessonIds", mapper.writeStringList(dismissal.lessonIds().ids()));
            params.put("groupKey", dismissal.groupKey());
            params.put("dismissedBy", dismissal.dismissedBy());
            params.put("dismissedAt", dismissal.dismissedAt().toString());
            params.put("detectionMethod", dismissal.detectionMethod() != null ? dismissal.detectionMethod().wireName() : null);
            params.put("notes", dismissal.notes());
            tx.apply("append dismissal " + dismissal.dismissalId(),
                    () -> execute("""
                            CREATE (:GroupDismissal {dismissalId: $dismissalId, lessonIds: $lessonIds,
                                groupKey: $groupKey, dismissedBy: $dismissedBy, dismissedAt: $dismissedAt,
                                detectionMethod: $detectionMethod, notes: $notes})
                            """, params),
                    () -> execute("MATCH (g:GroupDismissal {dismissalId: $dismissalId}) DELETE g",
                            Map.of("dismissalId", dismissal.dismissalId())));
        }

        private void writeLesson(LessonRecord lesson) {
            execute("MATCH (l:Lesson {lessonId: $lessonId}) SET " + LESSON_SET, mapper.toProperties(lesson));
        }

        /**
         * Undoes an archival, recreating the live lesson before anything else is removed.
         */
        private void restoreArchived(ArchiveRecord archive, LessonRecord previous, List<String> repointed) {
            String lessonId = archive.lessonId();
            execute("CREATE (l:Lesson {lessonId: $lessonId}) SET " + LESSON_SET, mapper.toProperties(previous));
            execute("MATCH (c:CanonicalLink {archivedLessonId: $lessonId}) DELETE c", Map.of("lessonId", lessonId));
            if (!repointed.isEmpty()) {
                execute("""
                        MATCH (c:CanonicalLink) WHERE c.archivedLessonId IN $archivedLessonIds
                        SET c.canonicalId = $lessonId
                        """, Map.of("archivedLessonIds", repointed, "lessonId", lessonId));
            }
            execute("MATCH (a:LessonArchive {archiveId: $archiveId}) DELETE a",
                    Map.of("archiveId", archive.archiveId()));
        }
    }
}
