package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.ArchiveRecord;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.GroupResolutionState;
import com.lesson.dedup.core.model.LessonIdSet;
import com.lesson.dedup.core.model.ResolutionDecision;
import com.lesson.dedup.store.ContentStore;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tells whether a candidate group has already been handled.
 *
 * <p>A group is <em>archived</em> when any resolution decision or archive record names one of
 * its ids as canonical, or when any of its ids has itself been archived; the reported time is
 * the latest such event. Otherwise it is <em>dismissed</em> when a dismissal covers exactly
 * the same id set. Subsets and supersets of a dismissed set are not dismissed.</p>
 */
public class GroupResolutionStateChecker {

    private final ContentStore store;

    public GroupResolutionStateChecker(ContentStore store) {
        this.store = store;
    }

    public GroupResolutionState check(LessonIdSet lessonIds) {
        return checkAll(List.of(lessonIds)).get(lessonIds);
    }

    /**
     * Checks many groups with one round of store reads.
     */
    public Map<LessonIdSet, GroupResolutionState> checkAll(Collection<LessonIdSet> groups) {
        Set<String> allIds = new TreeSet<>();
        groups.forEach(g -> allIds.addAll(g.ids()));

        Map<LessonIdSet, GroupResolutionState> result = new LinkedHashMap<>();
        if (allIds.isEmpty()) {
            groups.forEach(g -> result.put(g, GroupResolutionState.notResolved()));
            return result;
        }

        List<ResolutionDecision> decisions = store.findDecisionsByCanonical(allIds);
        List<ArchiveRecord> archivesByCanonical = store.findArchivesByCanonical(allIds);
        List<ArchiveRecord> archivedMembers = store.findArchives(allIds);
        List<DismissalRecord> dismissals = store.findDismissals();

        for (LessonIdSet group : groups) {
            result.put(group, stateOf(group, decisions, archivesByCanonical, archivedMembers, dismissals));
        }
        return result;
    }

    private static GroupResolutionState stateOf(LessonIdSet group,
                                                List<ResolutionDecision> decisions,
                                                List<ArchiveRecord> archivesByCanonical,
                                                List<ArchiveRecord> archivedMembers,
                                                List<DismissalRecord> dismissals) {
        Instant archivedAt = null;
        for (ResolutionDecision decision : decisions) {
            if (group.contains(decision.canonicalId())) {
                archivedAt = latest(archivedAt, decision.resolvedAt());
            }
        }
        for (ArchiveRecord archive : archivesByCanonical) {
            if (group.contains(archive.canonicalId())) {
                archivedAt = latest(archivedAt, archive.archivedAt());
            }
        }
        for (ArchiveRecord archive : archivedMembers) {
            if (group.contains(archive.lessonId())) {
                archivedAt = latest(archivedAt, archive.archivedAt());
            }
        }
        if (archivedAt != null) {
            return GroupResolutionState.archived(archivedAt);
        }

        Instant dismissedAt = null;
        for (DismissalRecord dismissal : dismissals) {
            if (dismissal.matches(group)) {
                dismissedAt = latest(dismissedAt, dismissal.dismissedAt());
            }
        }
        return dismissedAt != null ? GroupResolutionState.dismissed(dismissedAt) : GroupResolutionState.notResolved();
    }

    private static Instant latest(Instant current, Instant candidate) {
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
