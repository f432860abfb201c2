package com.lesson.dedup.resolution;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured outcome of a mutating operation: either a value, or an error category with a
 * user-facing message and an optional remediation hint.
 */
public record OperationResult<T>(
        boolean success,
        T value,
        ErrorCategory category,
        String message,
        String hint
) {
    public OperationResult {
        if (!success) {
            Objects.requireNonNull(category, "category is required for a failed result");
        }
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(true, value, null, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorCategory category, String message, String hint) {
        return new OperationResult<>(false, null, category, message, hint);
    }

    public static <T> OperationResult<T> failure(ResolutionException e) {
        return failure(e.getCategory(), e.getMessage(), e.getHint());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> valueIfPresent() {
        return Optional.ofNullable(value);
    }
}
