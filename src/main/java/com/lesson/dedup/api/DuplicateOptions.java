package com.lesson.dedup.api;

import java.util.Set;

/**
 * Policy settings for duplicate detection and resolution.
 */
public class DuplicateOptions {

    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.95;
    private static final int DEFAULT_EMBEDDING_DIMENSION = 1536;
    private static final String DEFAULT_SENTINEL_TITLE = "Unknown";
    private static final String DEFAULT_TABLE_MARKER = "|";
    private static final int DEFAULT_PREVIEW_LENGTH = 500;
    private static final long DEFAULT_CACHE_TTL_SECONDS = 30;
    private static final String DEFAULT_ARCHIVE_REASON = "duplicate_resolution";

    private final double similarityThreshold;
    private final int embeddingDimension;
    private final String sentinelTitle;
    private final String tableMarker;
    private final int previewLength;
    private final boolean cacheEnabled;
    private final long cacheTtlSeconds;
    private final String archiveReason;
    private final Set<String> trustedServices;

    private DuplicateOptions(Builder builder) {
        this.similarityThreshold = builder.similarityThreshold;
        this.embeddingDimension = builder.embeddingDimension;
        this.sentinelTitle = builder.sentinelTitle;
        this.tableMarker = builder.tableMarker;
        this.previewLength = builder.previewLength;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheTtlSeconds = builder.cacheTtlSeconds;
        this.archiveReason = builder.archiveReason;
        this.trustedServices = Set.copyOf(builder.trustedServices);
    }

    /**
     * Minimum cosine similarity for an embedding match.
     */
    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    /**
     * Expected embedding length; vectors of any other length are ignored.
     */
    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    /**
     * Placeholder title of lessons whose real title is unknown; such lessons never pair.
     */
    public String getSentinelTitle() {
        return sentinelTitle;
    }

    /**
     * Marker that flags table-formatted content when it appears at least twice.
     */
    public String getTableMarker() {
        return tableMarker;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public String getArchiveReason() {
        return archiveReason;
    }

    /**
     * Service identities allowed to run resolution operations without a user profile.
     */
    public Set<String> getTrustedServices() {
        return trustedServices;
    }

    public static DuplicateOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private int embeddingDimension = DEFAULT_EMBEDDING_DIMENSION;
        private String sentinelTitle = DEFAULT_SENTINEL_TITLE;
        private String tableMarker = DEFAULT_TABLE_MARKER;
        private int previewLength = DEFAULT_PREVIEW_LENGTH;
        private boolean cacheEnabled = false;
        private long cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;
        private String archiveReason = DEFAULT_ARCHIVE_REASON;
        private Set<String> trustedServices = Set.of();

        public Builder similarityThreshold(double similarityThreshold) {
            if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be in (0.0, 1.0]");
            }
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder embeddingDimension(int embeddingDimension) {
            if (embeddingDimension <= 0) {
                throw new IllegalArgumentException("embeddingDimension must be positive");
            }
            this.embeddingDimension = embeddingDimension;
            return this;
        }

        public Builder sentinelTitle(String sentinelTitle) {
            this.sentinelTitle = sentinelTitle;
            return this;
        }

        public Builder tableMarker(String tableMarker) {
            if (tableMarker == null || tableMarker.isEmpty()) {
                throw new IllegalArgumentException("tableMarker must not be empty");
            }
            this.tableMarker = tableMarker;
            return this;
        }

        public Builder previewLength(int previewLength) {
            if (previewLength < 0) {
                throw new IllegalArgumentException("previewLength must not be negative");
            }
            this.previewLength = previewLength;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheTtlSeconds(long cacheTtlSeconds) {
            if (cacheTtlSeconds <= 0) {
                throw new IllegalArgumentException("cacheTtlSeconds must be positive");
            }
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder archiveReason(String archiveReason) {
            if (archiveReason == null || archiveReason.isBlank()) {
                throw new IllegalArgumentException("archiveReason must not be blank");
            }
            this.archiveReason = archiveReason;
            return this;
        }

        public Builder trustedServices(Set<String> trustedServices) {
            this.trustedServices = trustedServices != null ? trustedServices : Set.of();
            return this;
        }

        public DuplicateOptions build() {
            return new DuplicateOptions(this);
        }
    }
}
