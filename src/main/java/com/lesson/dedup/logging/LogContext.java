package com.lesson.dedup.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forArchive(correlationId, duplicateId, canonicalId)) {
 *     log.info("archive.completed archiveId={}", archiveId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forOperation(String correlationId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static LogContext forArchive(String correlationId, String duplicateId, String canonicalId) {
        return forOperation(correlationId, "archive")
                .with("duplicateId", duplicateId)
                .with("canonicalId", canonicalId);
    }

    public static LogContext forGroup(String correlationId, String operation, String groupKey) {
        return forOperation(correlationId, operation).with("groupKey", groupKey);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
