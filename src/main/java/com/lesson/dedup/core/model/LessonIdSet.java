package com.lesson.dedup.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * An unordered set of lesson ids, kept sorted so that two sets with the same members
 * compare equal and share the same {@link #key()}.
 */
public final class LessonIdSet {
    private final List<String> ids;

    private LessonIdSet(Set<String> sorted) {
        this.ids = Collections.unmodifiableList(new ArrayList<>(sorted));
    }

    /**
     * Builds a set from caller input, trimming ids and dropping duplicates.
     *
     * @throws IllegalArgumentException if the collection is null or holds a null or blank id
     */
    public static LessonIdSet of(Collection<String> lessonIds) {
        if (lessonIds == null) {
            throw new IllegalArgumentException("Lesson id set must not be null");
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String id : lessonIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Lesson ids must not be null or blank");
            }
            sorted.add(id.trim());
        }
        return new LessonIdSet(sorted);
    }

    public static LessonIdSet of(String... lessonIds) {
        return of(List.of(lessonIds));
    }

    /**
     * Sorted, distinct ids.
     */
    public List<String> ids() {
        return ids;
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public boolean contains(String lessonId) {
        return Collections.binarySearch(ids, lessonId) >= 0;
    }

    /**
     * Stable textual key: the sorted ids joined by commas.
     */
    public String key() {
        return String.join(",", ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ids.equals(((LessonIdSet) o).ids);
    }

    @Override
    public int hashCode() {
        return ids.hashCode();
    }

    @Override
    public String toString() {
        return "[" + key() + "]";
    }
}
