package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.DetailField;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds duplicates' classification data into the canonical lesson.
 *
 * <p>Set-valued fields become the union of canonical and duplicate values, canonical values
 * first. Single-valued fields are filled from the first duplicate that has one, and only where
 * the canonical is empty. Title and summary are never touched. Merging is idempotent: a second
 * merge with the same inputs changes nothing.</p>
 */
public class MetadataMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MetadataMergeEngine.class);

    /**
     * Result of a merge.
     *
     * @param merged      the canonical lesson after the merge
     * @param added       values each set-valued field gained
     * @param backfilled  single-valued fields that were filled in
     */
    public record MergeOutcome(
            LessonRecord merged,
            Map<ClassificationField, Set<String>> added,
            Map<DetailField, String> backfilled
    ) {
        public MergeOutcome {
            added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
            backfilled = Collections.unmodifiableMap(new LinkedHashMap<>(backfilled));
        }

        public boolean changed() {
            return !added.isEmpty() || !backfilled.isEmpty();
        }

        /**
         * Full merged value of every non-empty set-valued field, keyed by wire name.
         */
        public Map<String, List<String>> mergedValues() {
            Map<String, List<String>> values = new LinkedHashMap<>();
            merged.getClassifications().forEach((field, set) -> values.put(field.wireName(), List.copyOf(set)));
            return values;
        }
    }

    /**
     * Computes the merge without touching storage.
     */
    public MergeOutcome plan(LessonRecord canonical, List<LessonRecord> duplicates) {
        LessonRecord.Builder builder = canonical.toBuilder();
        Map<ClassificationField, Set<String>> added = new EnumMap<>(ClassificationField.class);
        Map<DetailField, String> backfilled = new EnumMap<>(DetailField.class);

        for (ClassificationField field : ClassificationField.values()) {
            Set<String> union = new LinkedHashSet<>(canonical.classification(field));
            for (LessonRecord duplicate : duplicates) {
                union.addAll(duplicate.classification(field));
            }
            if (union.size() > canonical.classification(field).size()) {
                Set<String> gained = new LinkedHashSet<>(union);
                gained.removeAll(canonical.classification(field));
                added.put(field, gained);
                builder.classification(field, union);
            }
        }

        for (DetailField field : DetailField.values()) {
            if (canonical.detail(field) != null) {
                continue;
            }
            for (LessonRecord duplicate : duplicates) {
                String value = duplicate.detail(field);
                if (value != null) {
                    backfilled.put(field, value);
                    builder.detail(field, value);
                    break;
                }
            }
        }
        return new MergeOutcome(builder.build(), added, backfilled);
    }

    /**
     * Merges the duplicates into the canonical inside the caller's transaction.
     *
     * @throws ResolutionException NOT_FOUND if any lesson is not live, INVALID_ARGUMENT if the
     *                             canonical is among the duplicates
     */
    public MergeOutcome mergeInto(StoreSession session, String canonicalId, List<String> duplicateIds, Instant now) {
        LessonRecord canonical = session.findLesson(canonicalId)
                .orElseThrow(() -> ResolutionException.notFound("Canonical lesson not found: " + canonicalId));
        List<LessonRecord> duplicates = new ArrayList<>();
        for (String duplicateId : duplicateIds) {
            if (duplicateId.equals(canonicalId)) {
                throw ResolutionException.invalidArgument("Canonical lesson " + canonicalId + " cannot be merged into itself");
            }
            duplicates.add(session.findLesson(duplicateId)
                    .orElseThrow(() -> ResolutionException.notFound("Lesson not found: " + duplicateId)));
        }

        MergeOutcome outcome = plan(canonical, duplicates);
        if (!outcome.changed()) {
            log.debug("merge.noop canonicalId={} duplicates={}", canonicalId, duplicateIds);
            return outcome;
        }
        LessonRecord merged = outcome.merged().toBuilder().updatedAt(now).build();
        session.updateLesson(merged);
        log.debug("merge.applied canonicalId={} fieldsExtended={} fieldsBackfilled={}",
                canonicalId, outcome.added().keySet(), outcome.backfilled().keySet());
        return new MergeOutcome(merged, outcome.added(), outcome.backfilled());
    }
}
