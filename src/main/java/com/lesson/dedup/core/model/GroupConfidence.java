package com.lesson.dedup.core.model;

/**
 * Confidence that a duplicate group really is a set of copies.
 */
public enum GroupConfidence {
    /** At least one pair matched on both title and embedding, or both methods appear in the group. */
    HIGH,
    /** Only one detection method contributed. */
    MEDIUM,
    LOW
}
