package com.lesson.dedup.audit;

/**
 * Auditable actions of the duplicate resolution workflow.
 */
public enum AuditAction {
    LESSON_ARCHIVED,
    METADATA_MERGED,
    GROUP_RESOLVED,
    GROUP_DISMISSED,
    PERMISSION_DENIED,
    OPERATION_FAILED
}
