package com.lesson.dedup.rest.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lesson.dedup.api.ArchiveReceipt;
import com.lesson.dedup.core.model.ClassificationField;
import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DuplicateGroup;
import com.lesson.dedup.core.model.DuplicatePair;
import com.lesson.dedup.core.model.GroupConfidence;
import com.lesson.dedup.core.model.LessonIdSet;
import com.lesson.dedup.core.model.LessonReviewDetails;
import com.lesson.dedup.resolution.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DtoTest {

    // ========== Request defaults ==========

    @Test
    @DisplayName("ResolveGroupRequest merges metadata unless told otherwise")
    void testResolveGroupRequestDefaults() {
        ResolveGroupRequest req = new ResolveGroupRequest("keep", null, null, null);
        assertTrue(req.mergeMetadata());
        assertEquals(List.of(), req.duplicateIds());

        assertFalse(new ResolveGroupRequest("keep", List.of("dup"), false, null).mergeMetadata());
        assertEquals(Map.of(), req.titleUpdates());
    }

    @Test
    @DisplayName("Request DTOs accept blank ids and leave validation to the resolver")
    void testRequestsDoNotValidate() {
        assertDoesNotThrow(() -> new ArchiveRequest(" ", null));
        assertEquals(List.of(), new DismissRequest(null, null, null).lessonIds());
        assertEquals(List.of(), new LessonIdsRequest(null).lessonIds());
        assertEquals(List.of(), new MergeRequest(null, null).duplicateIds());
    }

    // ========== ErrorResponse ==========

    @Test
    @DisplayName("ErrorResponse carries category and hint in details")
    void testErrorResponseOf() {
        ErrorResponse error = ErrorResponse.of(ErrorCategory.NOT_FOUND, "Lesson not found: x",
                "It may already be archived", "/api/v1/duplicates/archive");

        assertEquals(404, error.status());
        assertEquals("Not Found", error.error());
        assertEquals("NOT_FOUND", error.details().get("category"));
        assertEquals("It may already be archived", error.details().get("hint"));
        assertNotNull(error.timestamp());
    }

    @Test
    @DisplayName("Every error category has a distinct status")
    void testStatusMapping() {
        assertEquals(403, ErrorResponse.statusFor(ErrorCategory.PERMISSION_DENIED));
        assertEquals(404, ErrorResponse.statusFor(ErrorCategory.NOT_FOUND));
        assertEquals(400, ErrorResponse.statusFor(ErrorCategory.INVALID_ARGUMENT));
        assertEquals(409, ErrorResponse.statusFor(ErrorCategory.CONFLICT));
        assertEquals(503, ErrorResponse.statusFor(ErrorCategory.STORAGE_FAILURE));
    }

    // ========== GroupResponse ==========

    @Test
    @DisplayName("GroupResponse flattens the group for the wire")
    void testGroupResponseFrom() {
        DuplicatePair pair = new DuplicatePair("a", "b", "Compost", "Compost", 0.99, DetectionMethod.BOTH);
        DuplicateGroup group = new DuplicateGroup(LessonIdSet.of("b", "a"), List.of(pair),
                DetectionMethod.BOTH, GroupConfidence.HIGH, 0.99, "a");

        GroupResponse response = GroupResponse.from(group);

        assertEquals(List.of("a", "b"), response.lessonIds());
        assertEquals("both", response.detectionMethod());
        assertEquals("high", response.confidence());
        assertEquals(1, response.pairCount());
        assertEquals("a", response.recommendedCanonicalId());
        assertEquals("both", response.pairs().get(0).detectionMethod());
    }

    // ========== Wire names ==========

    @Test
    @DisplayName("Pair, state and archive bodies use the published field names")
    void testWireFieldNames() {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode pair = mapper.valueToTree(PairResponse.from(
                new DuplicatePair("a", "b", "Compost", "compost", 0.97, DetectionMethod.EMBEDDING)));
        assertEquals("a", pair.get("id1").asText());
        assertEquals("b", pair.get("id2").asText());
        assertEquals("embedding", pair.get("detectionMethod").asText());

        JsonNode state = mapper.valueToTree(new ResolutionStateResponse(false, "none", null));
        assertFalse(state.get("isResolved").asBoolean());
        assertEquals("none", state.get("resolutionType").asText());
        assertTrue(state.has("resolvedAt"));

        JsonNode archive = mapper.valueToTree(ArchiveResponse.from(new ArchiveReceipt("dup", "keep", "arch-1")));
        assertTrue(archive.get("success").asBoolean());
        assertEquals("dup", archive.get("archivedId").asText());
        assertEquals("keep", archive.get("canonicalId").asText());
        assertEquals("arch-1", archive.get("archiveRecordId").asText());
    }

    @Test
    @DisplayName("Lesson details expose grade levels, link and table flag at the top level")
    void testLessonDetailsResponseFrom() {
        LessonReviewDetails details = new LessonReviewDetails("a", "Compost", null, "https://files/a.pdf", 120,
                true, false, "Worms | soil | water", Map.of(
                        ClassificationField.GRADE_LEVELS, Set.of("3"),
                        ClassificationField.TAGS, Set.of("compost")),
                null);

        LessonDetailsResponse response = LessonDetailsResponse.from(details);

        assertEquals("a", response.id());
        assertEquals(List.of("3"), response.gradeLevels());
        assertEquals("https://files/a.pdf", response.link());
        assertTrue(response.hasTableFormatArtifact());
        assertEquals(List.of("compost"), response.classifications().get(ClassificationField.TAGS.wireName()));
    }

    @Test
    @DisplayName("Lessons without grade levels report an empty list")
    void testLessonDetailsWithoutGradeLevels() {
        LessonReviewDetails details = new LessonReviewDetails("a", "Compost", null, null, 0,
                false, false, "", Map.of(), null);

        assertEquals(List.of(), LessonDetailsResponse.from(details).gradeLevels());
    }
}
