package com.lesson.dedup.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A live lesson in the content store.
 *
 * <p>Instances are immutable. Classification sets are insertion-ordered and never null;
 * a lesson without an embedding carries an empty vector. Use {@link #toBuilder()} to
 * derive a modified copy.</p>
 */
public final class LessonRecord {
    private final String lessonId;
    private final String title;
    private final String summary;
    private final String fileLink;
    private final String contentText;
    private final float[] embedding;
    private final String contentHash;
    private final Map<ClassificationField, Set<String>> classifications;
    private final Map<DetailField, String> details;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastModified;

    private LessonRecord(Builder builder) {
        this.lessonId = builder.lessonId;
        this.title = builder.title != null ? builder.title : "";
        this.summary = builder.summary;
        this.fileLink = builder.fileLink;
        this.contentText = builder.contentText;
        this.embedding = builder.embedding != null ? builder.embedding.clone() : new float[0];
        this.contentHash = builder.contentHash;

        EnumMap<ClassificationField, Set<String>> sets = new EnumMap<>(ClassificationField.class);
        builder.classifications.forEach((field, values) -> {
            if (!values.isEmpty()) {
                sets.put(field, Collections.unmodifiableSet(new LinkedHashSet<>(values)));
            }
        });
        this.classifications = Collections.unmodifiableMap(sets);
        this.details = Collections.unmodifiableMap(new EnumMap<>(builder.details));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.lastModified = builder.lastModified;
    }

    public String getLessonId() {
        return lessonId;
    }

    public String getTitle() {
        return title;
    }

    public String getSummary() {
        return summary;
    }

    public String getFileLink() {
        return fileLink;
    }

    public String getContentText() {
        return contentText;
    }

    /**
     * Returns a copy of the embedding vector; empty when the lesson has none.
     */
    public float[] getEmbedding() {
        return embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding.length > 0;
    }

    /**
     * Embedding dimensionality, 0 when absent.
     */
    public int embeddingDimension() {
        return embedding.length;
    }

    public String getContentHash() {
        return contentHash;
    }

    public Map<ClassificationField, Set<String>> getClassifications() {
        return classifications;
    }

    /**
     * Values of one classification field, empty when unset.
     */
    public Set<String> classification(ClassificationField field) {
        return classifications.getOrDefault(field, Set.of());
    }

    public Map<DetailField, String> getDetails() {
        return details;
    }

    /**
     * Value of a single-valued field, or null when the lesson has none.
     */
    public String detail(DetailField field) {
        return details.get(field);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Source last-modified time reported by ingestion; may be null.
     */
    public Instant getLastModified() {
        return lastModified;
    }

    /**
     * Last-modified time, falling back to the creation time.
     */
    public Instant effectiveLastModified() {
        return lastModified != null ? lastModified : createdAt;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .lessonId(lessonId)
                .title(title)
                .summary(summary)
                .fileLink(fileLink)
                .contentText(contentText)
                .embedding(embedding)
                .contentHash(contentHash)
                .metadata(metadata)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastModified(lastModified);
        classifications.forEach(builder::classification);
        details.forEach(builder::detail);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LessonRecord that = (LessonRecord) o;
        return lessonId.equals(that.lessonId)
                && title.equals(that.title)
                && Objects.equals(summary, that.summary)
                && Objects.equals(fileLink, that.fileLink)
                && Objects.equals(contentText, that.contentText)
                && Arrays.equals(embedding, that.embedding)
                && Objects.equals(contentHash, that.contentHash)
                && classifications.equals(that.classifications)
                && details.equals(that.details)
                && metadata.equals(that.metadata)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt)
                && Objects.equals(lastModified, that.lastModified);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(lessonId, title, summary, fileLink, contentText, contentHash,
                classifications, details, metadata, createdAt, updatedAt, lastModified);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "LessonRecord{" +
                "lessonId='" + lessonId + '\'' +
                ", title='" + title + '\'' +
                ", embeddingDimension=" + embedding.length +
                ", classifications=" + classifications.keySet() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String lessonId;
        private String title;
        private String summary;
        private String fileLink;
        private String contentText;
        private float[] embedding;
        private String contentHash;
        private final Map<ClassificationField, Set<String>> classifications = new EnumMap<>(ClassificationField.class);
        private final Map<DetailField, String> details = new EnumMap<>(DetailField.class);
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastModified;

        public Builder lessonId(String lessonId) {
            this.lessonId = lessonId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder fileLink(String fileLink) {
            this.fileLink = fileLink;
            return this;
        }

        public Builder contentText(String contentText) {
            this.contentText = contentText;
            return this;
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding != null ? embedding.clone() : null;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        /**
         * Replaces the values of one classification field. Null and blank values are dropped.
         */
        public Builder classification(ClassificationField field, Collection<String> values) {
            Objects.requireNonNull(field, "field is required");
            Set<String> cleaned = new LinkedHashSet<>();
            if (values != null) {
                for (String value : values) {
                    if (value != null && !value.isBlank()) {
                        cleaned.add(value);
                    }
                }
            }
            if (cleaned.isEmpty()) {
                classifications.remove(field);
            } else {
                classifications.put(field, cleaned);
            }
            return this;
        }

        public Builder classification(ClassificationField field, String... values) {
            return classification(field, values != null ? Arrays.asList(values) : null);
        }

        /**
         * Sets a single-valued field; null or blank clears it.
         */
        public Builder detail(DetailField field, String value) {
            Objects.requireNonNull(field, "field is required");
            if (value == null || value.isBlank()) {
                details.remove(field);
            } else {
                details.put(field, value);
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastModified(Instant lastModified) {
            this.lastModified = lastModified;
            return this;
        }

        public LessonRecord build() {
            Objects.requireNonNull(lessonId, "lessonId is required");
            if (lessonId.isBlank()) {
                throw new IllegalArgumentException("lessonId must not be blank");
            }
            return new LessonRecord(this);
        }
    }
}
