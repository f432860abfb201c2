package com.lesson.dedup.api;

import com.lesson.dedup.audit.AuditAction;
import com.lesson.dedup.audit.AuditRepository;
import com.lesson.dedup.audit.AuditService;
import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.CanonicalLink;
import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.DuplicateGroup;
import com.lesson.dedup.core.model.DuplicatePair;
import com.lesson.dedup.core.model.GroupResolutionState;
import com.lesson.dedup.core.model.LessonIdSet;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.core.model.LessonReviewDetails;
import com.lesson.dedup.core.model.ResolutionDecision;
import com.lesson.dedup.detection.DetectionCache;
import com.lesson.dedup.detection.DuplicateGrouper;
import com.lesson.dedup.detection.DuplicatePairFinder;
import com.lesson.dedup.lock.DistributedLock;
import com.lesson.dedup.lock.GraphDistributedLock;
import com.lesson.dedup.lock.LockConfig;
import com.lesson.dedup.logging.LogContext;
import com.lesson.dedup.metrics.MetricsService;
import com.lesson.dedup.metrics.NoOpMetricsService;
import com.lesson.dedup.resolution.ArchivalEngine;
import com.lesson.dedup.resolution.CanonicalRecommender;
import com.lesson.dedup.resolution.DismissalTracker;
import com.lesson.dedup.resolution.ErrorCategory;
import com.lesson.dedup.resolution.GroupResolutionStateChecker;
import com.lesson.dedup.resolution.MetadataMergeEngine;
import com.lesson.dedup.resolution.OperationResult;
import com.lesson.dedup.resolution.ResolutionException;
import com.lesson.dedup.security.Caller;
import com.lesson.dedup.security.PermissionGate;
import com.lesson.dedup.security.RoleProvider;
import com.lesson.dedup.store.ContentStore;
import com.lesson.dedup.store.StoreException;
import com.lesson.dedup.store.StoreSession;
import com.lesson.dedup.store.graph.FalkorDBConnection;
import com.lesson.dedup.store.graph.GraphConnection;
import com.lesson.dedup.store.graph.GraphContentStore;
import com.lesson.dedup.store.graph.GraphRoleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Main entry point for duplicate lesson review.
 *
 * <p>Every operation first asks the {@link PermissionGate} whether the caller may review
 * duplicates, with a fresh role lookup. Reads throw {@link ResolutionException}; mutations
 * return an {@link OperationResult} so callers always get a categorized outcome.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * DuplicateResolver resolver = DuplicateResolver.builder()
 *     .falkorDB("localhost", 6379, "lessons")
 *     .options(DuplicateOptions.builder().similarityThreshold(0.95).build())
 *     .build();
 *
 * List&lt;DuplicateGroup&gt; groups = resolver.findDuplicateGroups(caller, false);
 * OperationResult&lt;ArchiveReceipt&gt; result =
 *     resolver.archiveDuplicateLesson(caller, "lesson-2", "lesson-1");
 * </pre>
 */
public class DuplicateResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DuplicateResolver.class);

    static final String STORAGE_FAILURE_MESSAGE = "Storage operation failed; no changes were applied";
    static final String STORAGE_FAILURE_HINT = "Retry the operation; if it keeps failing, check the content store";
    private static final int MAX_LINK_HOPS = 32;
    static final int MAX_TITLE_LENGTH = 500;

    private final ContentStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final DuplicateOptions options;
    private final PermissionGate permissionGate;
    private final DuplicatePairFinder pairFinder;
    private final DuplicateGrouper grouper;
    private final GroupResolutionStateChecker stateChecker;
    private final CanonicalRecommender recommender;
    private final ArchivalEngine archivalEngine;
    private final MetadataMergeEngine mergeEngine;
    private final DismissalTracker dismissalTracker;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final DetectionCache detectionCache;
    private final Clock clock;

    private DuplicateResolver(Builder builder, ContentStore store, RoleProvider roleProvider) {
        this.store = store;
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;
        this.clock = builder.clock;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        this.permissionGate = new PermissionGate(roleProvider, options.getTrustedServices());
        this.pairFinder = new DuplicatePairFinder(options.getSimilarityThreshold(),
                options.getEmbeddingDimension(), options.getSentinelTitle());
        this.grouper = new DuplicateGrouper();
        this.stateChecker = new GroupResolutionStateChecker(store);
        this.recommender = new CanonicalRecommender(clock);
        this.archivalEngine = new ArchivalEngine(options.getArchiveReason());
        this.mergeEngine = new MetadataMergeEngine();
        this.dismissalTracker = new DismissalTracker();
        this.detectionCache = options.isCacheEnabled()
                ? new DetectionCache(Duration.ofSeconds(options.getCacheTtlSeconds()), metricsService)
                : null;
    }

    // ========== Detection and review reads ==========

    /**
     * Lists candidate duplicate pairs among live lessons.
     *
     * @throws ResolutionException with PERMISSION_DENIED or STORAGE_FAILURE
     */
    public List<DuplicatePair> findDuplicatePairs(Caller caller) {
        return read("find_pairs", caller, this::currentPairs);
    }

    /**
     * Groups candidate pairs and recommends a canonical lesson per group.
     *
     * @param includeResolved when false, groups already archived or dismissed are left out
     */
    public List<DuplicateGroup> findDuplicateGroups(Caller caller, boolean includeResolved) {
        return read("find_groups", caller, () -> {
            List<DuplicateGroup> groups = grouper.group(currentPairs());
            if (!includeResolved && !groups.isEmpty()) {
                Map<LessonIdSet, GroupResolutionState> states = stateChecker.checkAll(
                        groups.stream().map(DuplicateGroup::lessonIds).toList());
                groups = groups.stream()
                        .filter(g -> !states.getOrDefault(g.lessonIds(), GroupResolutionState.notResolved()).isResolved())
                        .toList();
            }
            return withRecommendations(groups);
        });
    }

    /**
     * Returns review details for the requested lessons that are live, in request order.
     * Unknown ids are left out.
     */
    public List<LessonReviewDetails> getLessonDetailsForReview(Caller caller, Collection<String> lessonIds) {
        return read("lesson_details", caller, () -> {
            List<String> ids = distinctIds(lessonIds);
            if (ids.isEmpty()) {
                return List.of();
            }
            Map<String, LessonRecord> byId = store.findLessons(ids).stream()
                    .collect(Collectors.toMap(LessonRecord::getLessonId, Function.identity()));
            List<LessonReviewDetails> details = new ArrayList<>();
            for (String id : ids) {
                LessonRecord lesson = byId.get(id);
                if (lesson != null) {
                    details.add(toReviewDetails(lesson));
                }
            }
            return details;
        });
    }

    /**
     * Reports whether the exact set of lessons was already archived or dismissed.
     */
    public GroupResolutionState checkGroupAlreadyResolved(Caller caller, Collection<String> lessonIds) {
        return read("check_resolved", caller, () -> stateChecker.check(idSet(lessonIds)));
    }

    public Optional<ArchiveRecord> getArchiveRecord(Caller caller, String lessonId) {
        return read("get_archive", caller, () -> store.findArchive(requireId(lessonId, "lessonId")));
    }

    /**
     * Follows canonical links from a lesson id to the live lesson that now stands for it.
     * A live lesson resolves to itself.
     */
    public Optional<LessonRecord> resolveCanonical(Caller caller, String lessonId) {
        return read("resolve_canonical", caller, () -> {
            String current = requireId(lessonId, "lessonId");
            for (int hop = 0; hop < MAX_LINK_HOPS; hop++) {
                Optional<LessonRecord> live = store.findLesson(current);
                if (live.isPresent()) {
                    return live;
                }
                Optional<CanonicalLink> link = store.findCanonicalLink(current);
                if (link.isEmpty()) {
                    return Optional.<LessonRecord>empty();
                }
                current = link.get().canonicalId();
            }
            log.warn("canonical.chain.too_long lessonId={} hops={}", lessonId, MAX_LINK_HOPS);
            return Optional.<LessonRecord>empty();
        });
    }

    public List<ResolutionDecision> getResolutionHistory(Caller caller, String canonicalId) {
        return read("resolution_history", caller,
                () -> store.findDecisionsByCanonical(List.of(requireId(canonicalId, "canonicalId"))));
    }

    public List<DismissalRecord> listDismissals(Caller caller) {
        return read("list_dismissals", caller, store::findDismissals);
    }

    /**
     * Whether the caller may review duplicates right now.
     */
    public boolean canReviewDuplicates(Caller caller) {
        return permissionGate.canReviewDuplicates(caller);
    }

    // ========== Mutations ==========

    /**
     * Archives one duplicate lesson in favour of a canonical lesson.
     *
     * <p>Snapshot, link cleanup and deletion of the duplicate commit together or not at all.
     * A lesson can be archived only once: a retry for the same duplicate fails with
     * NOT_FOUND and writes nothing.</p>
     */
    public OperationResult<ArchiveReceipt> archiveDuplicateLesson(Caller caller, String duplicateId, String canonicalId) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forArchive(correlationId, duplicateId, canonicalId)) {
            return mutate("archive", caller, duplicateId, () -> {
                requireId(duplicateId, "duplicateId");
                requireId(canonicalId, "canonicalId");
                log.info("archive.starting actor={}", caller.actorId());
                Instant now = clock.instant();

                ArchivalEngine.ArchiveOutcome outcome = store.inTransaction(List.of(duplicateId, canonicalId), session -> {
                    ArchivalEngine.ArchiveOutcome archived = archivalEngine.archive(
                            session, duplicateId, canonicalId, caller.actorId(), now);
                    session.appendDecision(ResolutionDecision.builder()
                            .canonicalId(canonicalId)
                            .archivedIds(List.of(duplicateId))
                            .metadataMerged(false)
                            .resolvedBy(caller.actorId())
                            .resolvedAt(now)
                            .build());
                    return archived;
                });

                ArchiveRecord archive = outcome.archive();
                metricsService.incrementArchived(1);
                auditService.record(AuditAction.LESSON_ARCHIVED, duplicateId, caller.actorId(), Map.of(
                        "canonicalId", canonicalId,
                        "archiveId", archive.archiveId(),
                        "repointedLinks", outcome.repointedLinks()));
                log.info("archive.completed archiveId={} repointedLinks={}", archive.archiveId(), outcome.repointedLinks());
                return new ArchiveReceipt(duplicateId, canonicalId, archive.archiveId());
            });
        }
    }

    /**
     * Resolves a whole group without renaming any lesson.
     */
    public OperationResult<GroupResolutionReceipt> resolveGroup(Caller caller, String canonicalId,
                                                                Collection<String> duplicateIds,
                                                                boolean mergeMetadata, String notes) {
        return resolveGroup(caller, canonicalId, duplicateIds, mergeMetadata, notes, Map.of());
    }

    /**
     * Resolves a whole group in one transaction: applies the requested title changes, optionally
     * merges the duplicates' metadata into the canonical, then archives every duplicate and records
     * one decision. Title changes may target the canonical or any duplicate; a renamed duplicate is
     * archived under its new title.
     *
     * @param titleUpdates new title per lesson id; null or empty for none
     */
    public OperationResult<GroupResolutionReceipt> resolveGroup(Caller caller, String canonicalId,
                                                                Collection<String> duplicateIds,
                                                                boolean mergeMetadata, String notes,
                                                                Map<String, String> titleUpdates) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forOperation(correlationId, "resolve_group").with("canonicalId", canonicalId)) {
            return mutate("resolve_group", caller, canonicalId, () -> {
                requireId(canonicalId, "canonicalId");
                List<String> duplicates = requireDuplicates(canonicalId, duplicateIds);
                List<String> lockIds = new ArrayList<>(duplicates);
                lockIds.add(canonicalId);
                Map<String, String> titles = requireTitleUpdates(titleUpdates, lockIds);
                Instant now = clock.instant();
                log.info("group.resolve.starting duplicates={} mergeMetadata={} titleUpdates={} actor={}",
                        duplicates.size(), mergeMetadata, titles.size(), caller.actorId());

                GroupResolutionReceipt receipt = store.inTransaction(lockIds, session -> {
                    List<String> titleChanges = applyTitleUpdates(session, titles, now);
                    Map<String, List<String>> mergedValues = Map.of();
                    if (mergeMetadata) {
                        mergedValues = mergeEngine.mergeInto(session, canonicalId, duplicates, now).mergedValues();
                    }
                    List<String> archiveIds = new ArrayList<>();
                    for (String duplicateId : duplicates) {
                        archiveIds.add(archivalEngine.archive(session, duplicateId, canonicalId, caller.actorId(), now)
                                .archive().archiveId());
                    }
                    ResolutionDecision decision = ResolutionDecision.builder()
                            .canonicalId(canonicalId)
                            .archivedIds(duplicates)
                            .metadataMerged(mergeMetadata)
                            .mergedValues(mergedValues)
                            .resolvedBy(caller.actorId())
                            .resolvedAt(now)
                            .notes(withTitleChanges(notes, titleChanges))
                            .build();
                    session.appendDecision(decision);
                    return new GroupResolutionReceipt(canonicalId, duplicates, archiveIds, mergeMetadata,
                            mergedValues, titles, decision.decisionId());
                });

                metricsService.incrementArchived(duplicates.size());
                if (mergeMetadata) {
                    metricsService.incrementMerged();
                }
                for (String duplicateId : duplicates) {
                    auditService.record(AuditAction.LESSON_ARCHIVED, duplicateId, caller.actorId(),
                            Map.of("canonicalId", canonicalId, "decisionId", receipt.decisionId()));
                }
                auditService.record(AuditAction.GROUP_RESOLVED, canonicalId, caller.actorId(), Map.of(
                        "archivedIds", duplicates,
                        "action", mergeMetadata ? "merge_and_archive" : "archive_only",
                        "decisionId", receipt.decisionId()));
                log.info("group.resolve.completed decisionId={} archived={}", receipt.decisionId(), duplicates.size());
                return receipt;
            });
        }
    }

    /**
     * Merges the duplicates' classification data into the canonical without archiving anything.
     */
    public OperationResult<MergeReceipt> mergeMetadata(Caller caller, String canonicalId, Collection<String> duplicateIds) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forOperation(correlationId, "merge_metadata").with("canonicalId", canonicalId)) {
            return mutate("merge_metadata", caller, canonicalId, () -> {
                requireId(canonicalId, "canonicalId");
                List<String> duplicates = requireDuplicates(canonicalId, duplicateIds);
                List<String> lockIds = new ArrayList<>(duplicates);
                lockIds.add(canonicalId);
                Instant now = clock.instant();

                MetadataMergeEngine.MergeOutcome outcome = store.inTransaction(lockIds,
                        session -> mergeEngine.mergeInto(session, canonicalId, duplicates, now));

                Map<String, List<String>> added = new LinkedHashMap<>();
                outcome.added().forEach((field, values) -> added.put(field.wireName(), List.copyOf(values)));
                Map<String, String> backfilled = new LinkedHashMap<>();
                outcome.backfilled().forEach((field, value) -> backfilled.put(field.wireName(), value));
                MergeReceipt receipt = new MergeReceipt(canonicalId, duplicates, added, backfilled);

                if (receipt.changed()) {
                    metricsService.incrementMerged();
                    auditService.record(AuditAction.METADATA_MERGED, canonicalId, caller.actorId(), Map.of(
                            "sourceIds", duplicates,
                            "addedFields", List.copyOf(added.keySet()),
                            "backfilledFields", List.copyOf(backfilled.keySet())));
                }
                log.info("merge.completed changed={} addedFields={} backfilledFields={}",
                        receipt.changed(), added.size(), backfilled.size());
                return receipt;
            });
        }
    }

    /**
     * Records that an exact set of lessons are not duplicates. No lesson is modified.
     *
     * @param detectionMethod wire name of the method that surfaced the group, may be null
     */
    public OperationResult<DismissalRecord> dismissGroup(Caller caller, Collection<String> lessonIds,
                                                         String detectionMethod, String notes) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forOperation(correlationId, "dismiss")) {
            return mutate("dismiss", caller, null, () -> {
                LessonIdSet ids = idSet(lessonIds);
                DetectionMethod method = parseMethod(detectionMethod);
                ctx.with("groupKey", ids.key());
                Instant now = clock.instant();

                DismissalRecord record = store.inTransaction(ids.ids(),
                        session -> dismissalTracker.dismiss(session, ids, method, notes, caller.actorId(), now));

                metricsService.incrementDismissed();
                Map<String, Object> details = new HashMap<>();
                details.put("lessonIds", ids.ids());
                details.put("dismissalId", record.dismissalId());
                if (method != null) {
                    details.put("detectionMethod", method.wireName());
                }
                auditService.record(AuditAction.GROUP_DISMISSED, ids.key(), caller.actorId(), details);
                log.info("dismiss.completed dismissalId={} lessons={}", record.dismissalId(), ids.size());
                return record;
            });
        }
    }

    // ========== Accessors ==========

    public DuplicateOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public ContentStore getContentStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
    }

    // ========== Internals ==========

    private List<DuplicatePair> currentPairs() {
        return detectionCache != null ? detectionCache.pairs(this::scanPairs) : scanPairs();
    }

    private List<DuplicatePair> scanPairs() {
        long start = System.nanoTime();
        List<LessonRecord> lessons = store.findAllLessons();
        List<DuplicatePair> pairs = pairFinder.findPairs(lessons);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordDetection(pairs.size(), elapsed);
        log.info("detection.completed lessons={} pairs={} durationMs={}", lessons.size(), pairs.size(), elapsed.toMillis());
        return pairs;
    }

    private List<DuplicateGroup> withRecommendations(List<DuplicateGroup> groups) {
        if (groups.isEmpty()) {
            return groups;
        }
        Set<String> allIds = new LinkedHashSet<>();
        groups.forEach(g -> allIds.addAll(g.lessonIds().ids()));
        Map<String, LessonRecord> byId = store.findLessons(allIds).stream()
                .collect(Collectors.toMap(LessonRecord::getLessonId, Function.identity()));

        List<DuplicateGroup> result = new ArrayList<>(groups.size());
        for (DuplicateGroup group : groups) {
            List<LessonRecord> members = group.lessonIds().ids().stream()
                    .map(byId::get)
                    .filter(lesson -> lesson != null)
                    .toList();
            result.add(group.withRecommendedCanonical(recommender.recommend(members).orElse(null)));
        }
        return result;
    }

    private LessonReviewDetails toReviewDetails(LessonRecord lesson) {
        String text = lesson.getContentText() != null ? lesson.getContentText() : "";
        String summary = lesson.getSummary();
        return new LessonReviewDetails(
                lesson.getLessonId(),
                lesson.getTitle(),
                summary,
                lesson.getFileLink(),
                text.length(),
                hasTableArtifact(text, options.getTableMarker()),
                summary != null && !summary.isBlank(),
                preview(text, options.getPreviewLength()),
                lesson.getClassifications(),
                lesson.effectiveLastModified());
    }

    static boolean hasTableArtifact(String text, String marker) {
        int first = text.indexOf(marker);
        return first >= 0 && text.indexOf(marker, first + marker.length()) >= 0;
    }

    static String preview(String text, int length) {
        if (text.length() <= length) {
            return text;
        }
        int end = length;
        // keep surrogate pairs whole
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private <T> T read(String operation, Caller caller, Supplier<T> body) {
        Caller effective = caller != null ? caller : Caller.anonymous();
        if (!permissionGate.canReviewDuplicates(effective)) {
            deny(operation, effective, null);
            throw ResolutionException.permissionDenied(operation);
        }
        try {
            return body.get();
        } catch (ResolutionException e) {
            metricsService.incrementFailure(operation, e.getCategory());
            throw e;
        } catch (StoreException e) {
            log.error("read.failed operation={} error={}", operation, e.getMessage(), e);
            metricsService.incrementFailure(operation, ErrorCategory.STORAGE_FAILURE);
            throw new ResolutionException(ErrorCategory.STORAGE_FAILURE,
                    "Storage read failed", STORAGE_FAILURE_HINT, e);
        }
    }

    private <T> OperationResult<T> mutate(String operation, Caller caller, String subjectId, Supplier<T> body) {
        Caller effective = caller != null ? caller : Caller.anonymous();
        if (!permissionGate.canReviewDuplicates(effective)) {
            deny(operation, effective, subjectId);
            return OperationResult.failure(ResolutionException.permissionDenied(operation));
        }
        try {
            T value = body.get();
            if (detectionCache != null) {
                detectionCache.invalidate();
            }
            return OperationResult.success(value);
        } catch (ResolutionException e) {
            log.warn("{}.failed category={} error={}", operation, e.getCategory(), e.getMessage());
            return failed(operation, effective, subjectId, e.getCategory(), e.getMessage(), e.getHint());
        } catch (StoreException e) {
            log.error("{}.failed category={} error={}", operation, ErrorCategory.STORAGE_FAILURE, e.getMessage(), e);
            return failed(operation, effective, subjectId, ErrorCategory.STORAGE_FAILURE,
                    STORAGE_FAILURE_MESSAGE, STORAGE_FAILURE_HINT);
        } catch (RuntimeException e) {
            log.error("{}.failed category={} unexpected={}", operation, ErrorCategory.STORAGE_FAILURE,
                    e.getClass().getSimpleName(), e);
            return failed(operation, effective, subjectId, ErrorCategory.STORAGE_FAILURE,
                    STORAGE_FAILURE_MESSAGE, STORAGE_FAILURE_HINT);
        }
    }

    private <T> OperationResult<T> failed(String operation, Caller caller, String subjectId,
                                          ErrorCategory category, String message, String hint) {
        metricsService.incrementFailure(operation, category);
        Map<String, Object> details = new HashMap<>();
        details.put("operation", operation);
        details.put("category", category.name());
        details.put("message", message);
        auditService.record(AuditAction.OPERATION_FAILED, subjectId, caller.actorId(), details);
        return OperationResult.failure(category, message, hint);
    }

    private void deny(String operation, Caller caller, String subjectId) {
        log.warn("permission.denied operation={} caller={}", operation, caller.actorId());
        metricsService.incrementFailure(operation, ErrorCategory.PERMISSION_DENIED);
        auditService.record(AuditAction.PERMISSION_DENIED, subjectId, caller.actorId(),
                Map.of("operation", operation));
    }

    private static String requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw ResolutionException.invalidArgument(name + " must not be blank");
        }
        return id;
    }

    private static List<String> distinctIds(Collection<String> ids) {
        if (ids == null) {
            throw ResolutionException.invalidArgument("lessonIds is required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String id : ids) {
            distinct.add(requireId(id, "lessonId").strip());
        }
        return List.copyOf(distinct);
    }

    private static List<String> requireDuplicates(String canonicalId, Collection<String> duplicateIds) {
        List<String> duplicates = distinctIds(duplicateIds);
        if (duplicates.isEmpty()) {
            throw ResolutionException.invalidArgument("At least one duplicate lesson id is required");
        }
        if (duplicates.contains(canonicalId)) {
            throw ResolutionException.invalidArgument("Canonical lesson " + canonicalId + " is listed as its own duplicate");
        }
        return duplicates;
    }

    private static Map<String, String> requireTitleUpdates(Map<String, String> titleUpdates, Collection<String> groupIds) {
        if (titleUpdates == null || titleUpdates.isEmpty()) {
            return Map.of();
        }
        Map<String, String> titles = new TreeMap<>();
        titleUpdates.forEach((lessonId, title) -> {
            String id = requireId(lessonId, "titleUpdates lesson id").strip();
            if (!groupIds.contains(id)) {
                throw ResolutionException.invalidArgument("Title update for lesson " + id + " outside the resolved group");
            }
            if (title == null || title.isBlank()) {
                throw ResolutionException.invalidArgument("Invalid title for lesson " + id + ": title cannot be empty");
            }
            String stripped = title.strip();
            if (stripped.length() > MAX_TITLE_LENGTH) {
                throw ResolutionException.invalidArgument("Invalid title for lesson " + id + ": title exceeds "
                        + MAX_TITLE_LENGTH + " characters");
            }
            titles.put(id, stripped);
        });
        return titles;
    }

    /**
     * @return one {@code id: 'old' -> 'new'} entry per lesson whose title actually changed
     */
    private static List<String> applyTitleUpdates(StoreSession session, Map<String, String> titles, Instant now) {
        List<String> changes = new ArrayList<>();
        titles.forEach((lessonId, title) -> {
            // a missing lesson is reported by the merge or archival that follows
            LessonRecord lesson = session.findLesson(lessonId).orElse(null);
            if (lesson == null || lesson.getTitle().equals(title)) {
                return;
            }
            session.updateLesson(lesson.toBuilder().title(title).updatedAt(now).build());
            changes.add(lessonId + ": '" + lesson.getTitle() + "' -> '" + title + "'");
        });
        return changes;
    }

    private static String withTitleChanges(String notes, List<String> titleChanges) {
        if (titleChanges.isEmpty()) {
            return notes;
        }
        String changes = "Title updates: " + String.join("; ", titleChanges);
        return notes == null || notes.isBlank() ? changes : notes + "\n" + changes;
    }

    private static LessonIdSet idSet(Collection<String> ids) {
        if (ids == null) {
            throw ResolutionException.invalidArgument("lessonIds is required");
        }
        try {
            return LessonIdSet.of(ids);
        } catch (IllegalArgumentException e) {
            throw ResolutionException.invalidArgument(e.getMessage());
        }
    }

    private static DetectionMethod parseMethod(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return null;
        }
        try {
            return DetectionMethod.fromWireName(wireName.strip());
        } catch (IllegalArgumentException e) {
            throw ResolutionException.invalidArgument(e.getMessage());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for DuplicateResolver.
     */
    public static class Builder {
        private ContentStore contentStore;
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private RoleProvider roleProvider;
        private DuplicateOptions options = DuplicateOptions.defaults();
        private MetricsService metricsService;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private DistributedLock distributedLock;
        private LockConfig lockConfig = LockConfig.defaults();
        private Clock clock = Clock.systemUTC();

        /**
         * Uses an existing content store. Takes precedence over a graph connection.
         */
        public Builder contentStore(ContentStore contentStore) {
            this.contentStore = contentStore;
            return this;
        }

        /**
         * Sets the graph connection to use.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection with the given parameters. The resolver closes it.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        /**
         * Source of profile roles. Defaults to user profiles in the graph when a connection is set.
         */
        public Builder roleProvider(RoleProvider roleProvider) {
            this.roleProvider = roleProvider;
            return this;
        }

        public Builder options(DuplicateOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        /**
         * Lock used by the graph store. Defaults to a graph-backed lock, shared across processes.
         */
        public Builder distributedLock(DistributedLock distributedLock) {
            this.distributedLock = distributedLock;
            return this;
        }

        /**
         * Tuning for the default graph-backed lock. Ignored when a lock is set explicitly.
         */
        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DuplicateResolver build() {
            if (contentStore == null && connection == null) {
                throw new IllegalStateException("A ContentStore or GraphConnection is required");
            }
            if (options == null) {
                throw new IllegalStateException("Options must not be null");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock must not be null");
            }

            ContentStore store = contentStore;
            if (store == null) {
                if (createIndexes) {
                    connection.createIndexes();
                }
                DistributedLock lock = distributedLock != null
                        ? distributedLock : new GraphDistributedLock(connection, lockConfig);
                store = new GraphContentStore(connection, lock);
            }

            RoleProvider roles = roleProvider;
            if (roles == null) {
                if (connection == null) {
                    throw new IllegalStateException("A RoleProvider is required when no GraphConnection is set");
                }
                roles = new GraphRoleProvider(connection);
            }
            return new DuplicateResolver(this, store, roles);
        }
    }
}
