package com.lesson.dedup.rest.dto;

import com.lesson.dedup.resolution.ErrorCategory;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path,
                         Map<String, String> details) {
        this(status, error, message, path, Instant.now(), details);
    }

    /**
     * Builds the body for a failed operation; a remediation hint goes under {@code details.hint}.
     */
    public static ErrorResponse of(ErrorCategory category, String message, String hint, String path) {
        Map<String, String> details = hint != null
                ? Map.of("category", category.name(), "hint", hint)
                : Map.of("category", category.name());
        return new ErrorResponse(statusFor(category), reasonFor(category), message, path, details);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static int statusFor(ErrorCategory category) {
        return switch (category) {
            case PERMISSION_DENIED -> 403;
            case NOT_FOUND -> 404;
            case INVALID_ARGUMENT -> 400;
            case CONFLICT -> 409;
            case STORAGE_FAILURE -> 503;
        };
    }

    private static String reasonFor(ErrorCategory category) {
        return switch (category) {
            case PERMISSION_DENIED -> "Forbidden";
            case NOT_FOUND -> "Not Found";
            case INVALID_ARGUMENT -> "Bad Request";
            case CONFLICT -> "Conflict";
            case STORAGE_FAILURE -> "Service Unavailable";
        };
    }
}
