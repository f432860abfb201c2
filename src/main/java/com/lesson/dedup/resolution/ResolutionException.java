package com.lesson.dedup.resolution;

import java.util.Objects;

/**
 * Categorised failure raised inside a resolution operation. Throwing it from within a
 * store transaction aborts the transaction.
 */
public class ResolutionException extends RuntimeException {
    private final ErrorCategory category;
    private final String hint;

    public ResolutionException(ErrorCategory category, String message) {
        this(category, message, null, null);
    }

    public ResolutionException(ErrorCategory category, String message, String hint) {
        this(category, message, hint, null);
    }

    public ResolutionException(ErrorCategory category, String message, String hint, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category is required");
        this.hint = hint;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * Remediation hint for the caller, may be null.
     */
    public String getHint() {
        return hint;
    }

    public static ResolutionException permissionDenied(String operation) {
        return new ResolutionException(ErrorCategory.PERMISSION_DENIED,
                "Permission denied: " + operation + " requires admin, reviewer, or super_admin role",
                "Ask an administrator to grant the reviewer role");
    }

    public static ResolutionException notFound(String message) {
        return new ResolutionException(ErrorCategory.NOT_FOUND, message);
    }

    public static ResolutionException notFound(String message, String hint) {
        return new ResolutionException(ErrorCategory.NOT_FOUND, message, hint);
    }

    public static ResolutionException invalidArgument(String message) {
        return new ResolutionException(ErrorCategory.INVALID_ARGUMENT, message);
    }

    public static ResolutionException conflict(String message, String hint) {
        return new ResolutionException(ErrorCategory.CONFLICT, message, hint);
    }
}
