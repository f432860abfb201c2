package com.lesson.dedup.detection;

import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DuplicateGroup;
import com.lesson.dedup.core.model.DuplicatePair;
import com.lesson.dedup.core.model.GroupConfidence;
import com.lesson.dedup.core.model.LessonIdSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups duplicate pairs into connected components with union-find.
 *
 * <p>Groups are derived on every call and never stored. They are ordered by confidence
 * (high first), then by size (largest first), then by the position of their first pair in
 * the input.</p>
 */
public class DuplicateGrouper {

    private static final Comparator<DuplicateGroup> GROUP_ORDER = Comparator
            .comparingInt((DuplicateGroup g) -> g.confidence().ordinal())
            .thenComparing(g -> g.lessonIds().size(), Comparator.reverseOrder());

    public List<DuplicateGroup> group(List<DuplicatePair> pairs) {
        UnionFind components = new UnionFind();
        for (DuplicatePair pair : pairs) {
            components.union(pair.lessonId1(), pair.lessonId2());
        }

        Map<String, List<DuplicatePair>> byRoot = new LinkedHashMap<>();
        for (DuplicatePair pair : pairs) {
            byRoot.computeIfAbsent(components.find(pair.lessonId1()), k -> new ArrayList<>()).add(pair);
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        for (List<DuplicatePair> members : byRoot.values()) {
            groups.add(analyze(members));
        }
        // List.sort is stable, so equal groups keep first-appearance order
        groups.sort(GROUP_ORDER);
        return groups;
    }

    /**
     * Summarizes the pairs of one component.
     */
    static DuplicateGroup analyze(List<DuplicatePair> pairs) {
        Set<String> ids = new LinkedHashSet<>();
        Set<DetectionMethod> methods = EnumSet.noneOf(DetectionMethod.class);
        double sum = 0.0;
        int withSimilarity = 0;
        for (DuplicatePair pair : pairs) {
            ids.add(pair.lessonId1());
            ids.add(pair.lessonId2());
            methods.add(pair.matchType());
            if (pair.similarity() != null) {
                sum += pair.similarity();
                withSimilarity++;
            }
        }

        DetectionMethod method;
        if (methods.size() == 1) {
            method = methods.iterator().next();
        } else if (methods.contains(DetectionMethod.BOTH)) {
            method = DetectionMethod.BOTH;
        } else {
            method = DetectionMethod.MIXED;
        }

        GroupConfidence confidence;
        if (methods.contains(DetectionMethod.BOTH)
                || (methods.contains(DetectionMethod.SAME_TITLE) && methods.contains(DetectionMethod.EMBEDDING))) {
            confidence = GroupConfidence.HIGH;
        } else if (methods.contains(DetectionMethod.SAME_TITLE) || methods.contains(DetectionMethod.EMBEDDING)) {
            confidence = GroupConfidence.MEDIUM;
        } else {
            confidence = GroupConfidence.LOW;
        }

        Double avgSimilarity = withSimilarity > 0 ? sum / withSimilarity : null;
        return new DuplicateGroup(LessonIdSet.of(ids), pairs, method, confidence, avgSimilarity, null);
    }

    private static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();

        String find(String id) {
            String root = id;
            while (true) {
                String next = parent.getOrDefault(root, root);
                if (next.equals(root)) {
                    break;
                }
                root = next;
            }
            // path compression
            String current = id;
            while (!current.equals(root)) {
                String next = parent.get(current);
                parent.put(current, root);
                current = next;
            }
            return root;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (!rootA.equals(rootB)) {
                parent.put(rootB, rootA);
            }
        }
    }
}
