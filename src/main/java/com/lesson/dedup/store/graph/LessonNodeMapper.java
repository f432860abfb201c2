package com.lesson.dedup.store.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.DetailField;
import com.lesson.dedup.core.model.LessonRecord;
import com.lesson.dedup.store.StoreException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps lessons to flat graph node properties and back.
 *
 * <p>Graph properties are scalars, so collections (embedding, classifications, details,
 * metadata) are stored as JSON strings and timestamps as ISO-8601 strings. The same
 * property map, serialized as a whole, is the snapshot stored on archive nodes.</p>
 */
public class LessonNodeMapper {

    static final List<String> PROPERTIES = List.of(
            "lessonId", "title", "summary", "fileLink", "contentText", "embedding", "contentHash",
            "classifications", "details", "metadata", "createdAt", "updatedAt", "lastModified");

    private static final TypeReference<Map<String, List<String>>> CLASSIFICATIONS = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> DETAILS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public LessonNodeMapper() {
        this(new ObjectMapper());
    }

    public LessonNodeMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Node properties for a lesson, keyed as in {@link #PROPERTIES}.
     */
    public Map<String, Object> toProperties(LessonRecord lesson) {
        Map<String, List<String>> classifications = new LinkedHashMap<>();
        lesson.getClassifications().forEach((field, values) -> classifications.put(field.wireName(), List.copyOf(values)));
        Map<String, String> details = new LinkedHashMap<>();
        lesson.getDetails().forEach((field, value) -> details.put(field.wireName(), value));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("lessonId", lesson.getLessonId());
        props.put("title", lesson.getTitle());
        props.put("summary", lesson.getSummary());
        props.put("fileLink", lesson.getFileLink());
        props.put("contentText", lesson.getContentText());
        props.put("embedding", lesson.hasEmbedding() ? writeJson(lesson.getEmbedding()) : null);
        props.put("contentHash", lesson.getContentHash());
        props.put("classifications", writeJson(classifications));
        props.put("details", writeJson(details));
        props.put("metadata", writeJson(lesson.getMetadata()));
        props.put("createdAt", lesson.getCreatedAt().toString());
        props.put("updatedAt", lesson.getUpdatedAt().toString());
        props.put("lastModified", lesson.getLastModified() != null ? lesson.getLastModified().toString() : null);
        return props;
    }

    /**
     * Rebuilds a lesson from a result row or a property map.
     */
    public LessonRecord fromProperties(Map<String, Object> row) {
        LessonRecord.Builder builder = LessonRecord.builder()
                .lessonId(string(row, "lessonId"))
                .title(string(row, "title"))
                .summary(string(row, "summary"))
                .fileLink(string(row, "fileLink"))
                .contentText(string(row, "contentText"))
                .contentHash(string(row, "contentHash"))
                .createdAt(instant(row, "createdAt"))
                .updatedAt(instant(row, "updatedAt"))
                .lastModified(instant(row, "lastModified"));

        String embedding = string(row, "embedding");
        if (embedding != null && !embedding.isBlank()) {
            builder.embedding(readJson(embedding, float[].class));
        }
        String classifications = string(row, "classifications");
        if (classifications != null) {
            readJson(classifications, CLASSIFICATIONS).forEach((field, values) ->
                    builder.classification(ClassificationField.fromWireName(field), values));
        }
        String details = string(row, "details");
        if (details != null) {
            readJson(details, DETAILS).forEach((field, value) ->
                    builder.detail(DetailField.fromWireName(field), value));
        }
        String metadata = string(row, "metadata");
        if (metadata != null) {
            builder.metadata(readJson(metadata, OBJECT_MAP));
        }
        return builder.build();
    }

    /**
     * Serializes a whole lesson for an archive snapshot.
     */
    public String toSnapshot(LessonRecord lesson) {
        return writeJson(toProperties(lesson));
    }

    public LessonRecord fromSnapshot(String json) {
        return fromProperties(readJson(json, OBJECT_MAP));
    }

    public String writeStringList(List<String> values) {
        return writeJson(values);
    }

    public List<String> readStringList(String json) {
        return json == null ? List.of() : readJson(json, STRING_LIST);
    }

    public String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize graph property", e);
        }
    }

    public <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to parse graph property", e);
        }
    }

    public <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to parse graph property", e);
        }
    }

    static String string(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value != null ? value.toString() : null;
    }

    static Instant instant(Map<String, Object> row, String key) {
        String value = string(row, key);
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
