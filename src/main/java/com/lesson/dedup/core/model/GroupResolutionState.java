package com.lesson.dedup.core.model;

import java.time.Instant;

/**
 * Whether a candidate group was already archived or dismissed, and when.
 */
public record GroupResolutionState(ResolutionState state, Instant resolvedAt) {

    private static final GroupResolutionState NOT_RESOLVED = new GroupResolutionState(ResolutionState.NOT_RESOLVED, null);

    public static GroupResolutionState notResolved() {
        return NOT_RESOLVED;
    }

    public static GroupResolutionState archived(Instant resolvedAt) {
        return new GroupResolutionState(ResolutionState.ARCHIVED, resolvedAt);
    }

    public static GroupResolutionState dismissed(Instant resolvedAt) {
        return new GroupResolutionState(ResolutionState.DISMISSED, resolvedAt);
    }

    public boolean isResolved() {
        return state != ResolutionState.NOT_RESOLVED;
    }
}
