package com.lesson.dedup.rest.dto;

/**
 * Request DTO for archiving one duplicate lesson. Ids are validated by the resolver, after
 * the permission check.
 */
public record ArchiveRequest(
        String duplicateId,
        String canonicalId
) {
}
