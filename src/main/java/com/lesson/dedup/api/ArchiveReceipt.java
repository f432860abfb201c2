package com.lesson.dedup.api;

/**
 * Result of archiving one duplicate lesson.
 */
public record ArchiveReceipt(String archivedLessonId, String canonicalLessonId, String archiveId) {
}
