package com.lesson.dedup.resolution;

/**
 * Failure categories reported by every mutating operation.
 */
public enum ErrorCategory {
    PERMISSION_DENIED,
    NOT_FOUND,
    INVALID_ARGUMENT,
    /** Target already archived or dismissed. */
    CONFLICT,
    /** Transaction aborted for infrastructure reasons; nothing was applied. */
    STORAGE_FAILURE
}
