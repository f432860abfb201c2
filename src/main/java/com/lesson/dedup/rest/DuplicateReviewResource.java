package com.lesson.dedup.rest;

import com.lesson.dedup.api.DuplicateResolver;
import com.lesson.dedup.resolution.ErrorCategory;
import com.lesson.dedup.resolution.OperationResult;
import com.lesson.dedup.resolution.ResolutionException;
import com.lesson.dedup.rest.dto.ArchiveRecordResponse;
import com.lesson.dedup.rest.dto.ArchiveRequest;
import com.lesson.dedup.rest.dto.ArchiveResponse;
import com.lesson.dedup.rest.dto.DismissRequest;
import com.lesson.dedup.rest.dto.DismissalResponse;
import com.lesson.dedup.rest.dto.ErrorResponse;
import com.lesson.dedup.rest.dto.GroupResponse;
import com.lesson.dedup.rest.dto.LessonDetailsResponse;
import com.lesson.dedup.rest.dto.LessonIdsRequest;
import com.lesson.dedup.rest.dto.MergeRequest;
import com.lesson.dedup.rest.dto.PairResponse;
import com.lesson.dedup.rest.dto.ResolutionStateResponse;
import com.lesson.dedup.rest.dto.ResolveGroupRequest;
import com.lesson.dedup.rest.security.CallerContext;
import com.lesson.dedup.security.Caller;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * REST resource for reviewing and resolving duplicate lessons.
 *
 * <p>Security: the API key only identifies the caller. Every endpoint, reads included, is
 * authorized by the resolver against the caller's current profile role, and a denial is
 * returned as {@code 403}.</p>
 */
@Path("/api/v1/duplicates")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Duplicate Review", description = "Detection, review and resolution of duplicate lessons")
@SecurityRequirement(name = "apiKey")
public class DuplicateReviewResource {
    private static final Logger log = LoggerFactory.getLogger(DuplicateReviewResource.class);
    private static final String BASE = "/api/v1/duplicates";

    private final DuplicateResolver resolver;

    @Inject
    public DuplicateReviewResource(DuplicateResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * GET /api/v1/duplicates/pairs
     */
    @GET
    @Path("/pairs")
    @Operation(summary = "List candidate pairs",
            description = "Returns lesson pairs with the same normalized title or near-identical embeddings.")
    @APIResponse(responseCode = "200", description = "Candidate pairs")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    public Response getPairs(@Context SecurityContext securityContext) {
        Caller caller = CallerContext.from(securityContext);
        return read("/pairs", () -> resolver.findDuplicatePairs(caller).stream().map(PairResponse::from).toList());
    }

    /**
     * GET /api/v1/duplicates/groups?includeResolved=false
     */
    @GET
    @Path("/groups")
    @Operation(summary = "List duplicate groups",
            description = "Returns connected groups of candidate pairs with a recommended canonical lesson. "
                    + "Groups already archived or dismissed are omitted unless includeResolved is set.")
    @APIResponse(responseCode = "200", description = "Duplicate groups")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    public Response getGroups(@Context SecurityContext securityContext,
                              @QueryParam("includeResolved") @DefaultValue("false") boolean includeResolved) {
        Caller caller = CallerContext.from(securityContext);
        return read("/groups", () -> resolver.findDuplicateGroups(caller, includeResolved).stream()
                .map(GroupResponse::from).toList());
    }

    /**
     * POST /api/v1/duplicates/details
     */
    @POST
    @Path("/details")
    @Operation(summary = "Get lesson details for review",
            description = "Returns review details for the live lessons among the given ids.")
    @APIResponse(responseCode = "200", description = "Lesson details")
    @APIResponse(responseCode = "400", description = "Malformed ids")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    public Response getDetails(@Context SecurityContext securityContext, LessonIdsRequest request) {
        Caller caller = CallerContext.from(securityContext);
        LessonIdsRequest body = request != null ? request : new LessonIdsRequest(null);
        return read("/details", () -> resolver.getLessonDetailsForReview(caller, body.lessonIds()).stream()
                .map(LessonDetailsResponse::from).toList());
    }

    /**
     * POST /api/v1/duplicates/state
     */
    @POST
    @Path("/state")
    @Operation(summary = "Check group resolution state",
            description = "Reports whether this exact set of lessons was already archived or dismissed.")
    @APIResponse(responseCode = "200", description = "Resolution state")
    @APIResponse(responseCode = "400", description = "Malformed ids")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    public Response getState(@Context SecurityContext securityContext, LessonIdsRequest request) {
        Caller caller = CallerContext.from(securityContext);
        LessonIdsRequest body = request != null ? request : new LessonIdsRequest(null);
        return read("/state", () -> ResolutionStateResponse.from(
                resolver.checkGroupAlreadyResolved(caller, body.lessonIds())));
    }

    /**
     * GET /api/v1/duplicates/archive/{id}
     */
    @GET
    @Path("/archive/{id}")
    @Operation(summary = "Get archive record", description = "Returns the archive record of an archived lesson.")
    @APIResponse(responseCode = "200", description = "Archive record found")
    @APIResponse(responseCode = "404", description = "Lesson was never archived")
    public Response getArchive(@Context SecurityContext securityContext,
                               @Parameter(description = "Archived lesson id") @PathParam("id") String lessonId) {
        Caller caller = CallerContext.from(securityContext);
        String path = "/archive/" + lessonId;
        try {
            return resolver.getArchiveRecord(caller, lessonId)
                    .map(archive -> Response.ok(ArchiveRecordResponse.from(archive)).build())
                    .orElseGet(() -> error(ErrorCategory.NOT_FOUND, "No archive record for lesson: " + lessonId,
                            null, path));
        } catch (ResolutionException e) {
            return error(e.getCategory(), e.getMessage(), e.getHint(), path);
        }
    }

    /**
     * POST /api/v1/duplicates/archive
     */
    @POST
    @Path("/archive")
    @Operation(summary = "Archive a duplicate lesson",
            description = "Snapshots the duplicate, re-points links to the canonical lesson and deletes the duplicate, "
                    + "all in one transaction.")
    @APIResponse(responseCode = "200", description = "Lesson archived")
    @APIResponse(responseCode = "400", description = "Malformed or self-referencing ids")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    @APIResponse(responseCode = "404", description = "Duplicate or canonical lesson not found")
    @APIResponse(responseCode = "409", description = "Lesson already archived")
    @APIResponse(responseCode = "503", description = "Storage failure, nothing applied")
    public Response archive(@Context SecurityContext securityContext, ArchiveRequest request) {
        Caller caller = CallerContext.from(securityContext);
        ArchiveRequest body = request != null ? request : new ArchiveRequest(null, null);
        return mutation("/archive", resolver.archiveDuplicateLesson(caller, body.duplicateId(), body.canonicalId()),
                ArchiveResponse::from);
    }

    /**
     * POST /api/v1/duplicates/resolve
     */
    @POST
    @Path("/resolve")
    @Operation(summary = "Resolve a duplicate group",
            description = "Applies any title updates, optionally merges metadata into the canonical lesson, "
                    + "then archives every duplicate.")
    @APIResponse(responseCode = "200", description = "Group resolved")
    @APIResponse(responseCode = "400", description = "Malformed ids, or a blank or over-long title")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    @APIResponse(responseCode = "404", description = "A lesson was not found")
    @APIResponse(responseCode = "409", description = "A lesson was already archived")
    @APIResponse(responseCode = "503", description = "Storage failure, nothing applied")
    public Response resolve(@Context SecurityContext securityContext, ResolveGroupRequest request) {
        Caller caller = CallerContext.from(securityContext);
        ResolveGroupRequest body = request != null ? request : new ResolveGroupRequest(null, null, null, null);
        return mutation("/resolve", resolver.resolveGroup(caller, body.canonicalId(), body.duplicateIds(),
                body.mergeMetadata(), body.notes(), body.titleUpdates()), Function.identity());
    }

    /**
     * POST /api/v1/duplicates/merge
     */
    @POST
    @Path("/merge")
    @Operation(summary = "Merge metadata",
            description = "Folds duplicates' classification data into the canonical lesson without archiving.")
    @APIResponse(responseCode = "200", description = "Metadata merged")
    @APIResponse(responseCode = "400", description = "Malformed ids")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    @APIResponse(responseCode = "404", description = "A lesson was not found")
    public Response merge(@Context SecurityContext securityContext, MergeRequest request) {
        Caller caller = CallerContext.from(securityContext);
        MergeRequest body = request != null ? request : new MergeRequest(null, null);
        return mutation("/merge", resolver.mergeMetadata(caller, body.canonicalId(), body.duplicateIds()),
                Function.identity());
    }

    /**
     * POST /api/v1/duplicates/dismiss
     */
    @POST
    @Path("/dismiss")
    @Operation(summary = "Dismiss a group",
            description = "Records that this exact set of lessons are not duplicates. No lesson is modified.")
    @APIResponse(responseCode = "200", description = "Group dismissed")
    @APIResponse(responseCode = "400", description = "Fewer than two ids, or unknown detection method")
    @APIResponse(responseCode = "403", description = "Caller may not review duplicates")
    @APIResponse(responseCode = "404", description = "A lesson was not found")
    @APIResponse(responseCode = "409", description = "Group already dismissed, or a lesson was archived")
    public Response dismiss(@Context SecurityContext securityContext, DismissRequest request) {
        Caller caller = CallerContext.from(securityContext);
        DismissRequest body = request != null ? request : new DismissRequest(null, null, null);
        return mutation("/dismiss", resolver.dismissGroup(caller, body.lessonIds(), body.detectionMethod(),
                body.notes()), DismissalResponse::from);
    }

    private Response read(String path, Supplier<?> body) {
        try {
            return Response.ok(body.get()).build();
        } catch (ResolutionException e) {
            log.warn("read.failed path={} category={} error={}", path, e.getCategory(), e.getMessage());
            return error(e.getCategory(), e.getMessage(), e.getHint(), path);
        }
    }

    private static <T> Response mutation(String path, OperationResult<T> result, Function<T, ?> toBody) {
        if (result.isSuccess()) {
            return Response.ok(toBody.apply(result.value())).build();
        }
        return error(result.category(), result.message(), result.hint(), path);
    }

    private static Response error(ErrorCategory category, String message, String hint, String path) {
        return Response.status(ErrorResponse.statusFor(category))
                .entity(ErrorResponse.of(category, message, hint, BASE + path))
                .build();
    }
}
