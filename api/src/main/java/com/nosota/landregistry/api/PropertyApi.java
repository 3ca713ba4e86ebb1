package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.SubmitPropertyRequest;
import com.nosota.landregistry.api.request.UpdatePropertyRequest;
import com.nosota.landregistry.api.response.OwnershipRecordResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import com.nosota.landregistry.api.response.WorkflowStatusResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Property application API.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Submitting a registration application and editing it while PENDING (owner)</li>
 *   <li>Starting review, approving and rejecting (land officer, admin)</li>
 *   <li>Reading applications, their workflow progress and ownership history</li>
 * </ul>
 *
 * <p>Every endpoint requires the {@link ActorHeaders#ACTOR_ID} and {@link ActorHeaders#ACTOR_ROLE}
 * headers. This interface is implemented by:
 * <ul>
 *   <li>PropertyController - in service module (server-side implementation)</li>
 *   <li>PropertyClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/properties")
public interface PropertyApi {

    /**
     * Submits a new registration application in PENDING status.
     *
     * <p>Fails with CONFLICT when the plot number is already registered, regardless of case.
     *
     * @param actorId   Caller id, becomes the owner
     * @param actorRole Caller role
     * @param request   Plot, location, area and type
     * @return Created application
     */
    @PostMapping
    ResponseEntity<PropertyResponse> submitProperty(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid SubmitPropertyRequest request);

    /**
     * Edits the location, area or type of a PENDING application. Owner only.
     *
     * <p>The plot number cannot be changed. Fails with CONFLICT once review has started or the
     * application is closed.
     *
     * @param propertyId The application ID
     * @param request    Fields to change
     * @return Updated application
     */
    @PutMapping("/{propertyId}")
    ResponseEntity<PropertyResponse> updateProperty(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId,
            @RequestBody @Valid UpdatePropertyRequest request);

    @GetMapping("/{propertyId}")
    ResponseEntity<PropertyResponse> getProperty(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    /**
     * Lists applications owned by the caller, newest first.
     */
    @GetMapping("/mine")
    ResponseEntity<PagedResponse<PropertyResponse>> listMyProperties(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Lists all applications, optionally filtered by status. Land officers and admins only.
     *
     * @param status Optional status filter
     * @param page   Page number (0-indexed)
     * @param size   Page size
     * @return Paginated list of applications
     */
    @GetMapping
    ResponseEntity<PagedResponse<PropertyResponse>> listProperties(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "status", required = false) PropertyStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Recomputes the derived flags and reports what still blocks approval.
     */
    @GetMapping("/{propertyId}/workflow")
    ResponseEntity<WorkflowStatusResponse> getWorkflowStatus(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    @GetMapping("/{propertyId}/ownership-history")
    ResponseEntity<List<OwnershipRecordResponse>> getOwnershipHistory(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    /**
     * Moves a PENDING application to UNDER_REVIEW.
     */
    @PostMapping("/{propertyId}/review")
    ResponseEntity<PropertyResponse> startReview(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    /**
     * Approves an application.
     *
     * <p>Requires both derived flags. Fails with PRECONDITION_FAILED naming every missing
     * condition, and with FORBIDDEN when the caller owns the application.
     *
     * @param request Optional approval notes
     * @return Approved application
     */
    @PostMapping("/{propertyId}/approve")
    ResponseEntity<PropertyResponse> approve(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId,
            @RequestBody @Valid NotesRequest request);

    /**
     * Rejects an application. The reason is mandatory.
     */
    @PostMapping("/{propertyId}/reject")
    ResponseEntity<PropertyResponse> reject(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId,
            @RequestBody @Valid ReasonRequest request);
}
