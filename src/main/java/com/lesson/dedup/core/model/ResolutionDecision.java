package com.lesson.dedup.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of a resolution: which lessons were archived into which canonical,
 * and whether their metadata was merged first.
 */
public record ResolutionDecision(
        String decisionId,
        String canonicalId,
        List<String> archivedIds,
        DetectionMethod detectionMethod,
        boolean metadataMerged,
        Map<String, List<String>> mergedValues,
        String resolvedBy,
        Instant resolvedAt,
        String notes
) {
    public ResolutionDecision {
        Objects.requireNonNull(decisionId, "decisionId is required");
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(resolvedAt, "resolvedAt is required");
        archivedIds = archivedIds != null ? List.copyOf(archivedIds) : List.of();
        mergedValues = mergedValues != null ? Map.copyOf(mergedValues) : Map.of();
    }

    /**
     * Action label stored with the decision.
     */
    public String actionTaken() {
        return metadataMerged ? "merge_and_archive" : "archive_only";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String decisionId;
        private String canonicalId;
        private List<String> archivedIds = List.of();
        private DetectionMethod detectionMethod;
        private boolean metadataMerged;
        private Map<String, List<String>> mergedValues = Map.of();
        private String resolvedBy;
        private Instant resolvedAt;
        private String notes;

        public Builder decisionId(String decisionId) {
            this.decisionId = decisionId;
            return this;
        }

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder archivedIds(List<String> archivedIds) {
            this.archivedIds = archivedIds;
            return this;
        }

        public Builder detectionMethod(DetectionMethod detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder metadataMerged(boolean metadataMerged) {
            this.metadataMerged = metadataMerged;
            return this;
        }

        public Builder mergedValues(Map<String, List<String>> mergedValues) {
            this.mergedValues = mergedValues;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public ResolutionDecision build() {
            return new ResolutionDecision(
                    decisionId != null ? decisionId : UUID.randomUUID().toString(),
                    canonicalId, archivedIds, detectionMethod, metadataMerged, mergedValues,
                    resolvedBy, resolvedAt != null ? resolvedAt : Instant.now(), notes);
        }
    }
}
