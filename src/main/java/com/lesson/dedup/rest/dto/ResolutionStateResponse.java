package com.lesson.dedup.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lesson.dedup.core.model.GroupResolutionState;

import java.time.Instant;

/**
 * Response DTO for a group resolution check.
 *
 * @param resolutionType one of none, archived or dismissed
 */
public record ResolutionStateResponse(
        @JsonProperty("isResolved") boolean isResolved,
        String resolutionType,
        Instant resolvedAt
) {
    public static ResolutionStateResponse from(GroupResolutionState state) {
        return new ResolutionStateResponse(state.isResolved(), state.state().wireName(), state.resolvedAt());
    }
}
