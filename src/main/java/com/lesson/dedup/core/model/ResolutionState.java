package com.lesson.dedup.core.model;

/**
 * Outcome of checking whether a candidate group has already been handled.
 */
public enum ResolutionState {
    NOT_RESOLVED("none"),
    ARCHIVED("archived"),
    DISMISSED("dismissed");

    private final String wireName;

    ResolutionState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
