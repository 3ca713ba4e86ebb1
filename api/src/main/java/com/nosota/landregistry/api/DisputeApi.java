package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.api.request.AssignDisputeRequest;
import com.nosota.landregistry.api.request.DisputeStatusUpdateRequest;
import com.nosota.landregistry.api.request.FileDisputeRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.ResolveDisputeRequest;
import com.nosota.landregistry.api.response.DisputeResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Dispute resolution API.
 *
 * <p>Citizens file and withdraw disputes, officers move them through review, investigation
 * and mediation, and admins assign them to officers.
 */
@RequestMapping("/api/v1/disputes")
public interface DisputeApi {

    @PostMapping
    ResponseEntity<DisputeResponse> fileDispute(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid FileDisputeRequest request);

    @GetMapping("/{disputeId}")
    ResponseEntity<DisputeResponse> getDispute(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("disputeId") UUID disputeId);

    /**
     * Lists all disputes, optionally filtered by status. Land officers and admins only.
     */
    @GetMapping
    ResponseEntity<PagedResponse<DisputeResponse>> listDisputes(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "status", required = false) DisputeStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    @GetMapping("/mine")
    ResponseEntity<PagedResponse<DisputeResponse>> listMyDisputes(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Moves a dispute along the review edges. Notes are mandatory.
     *
     * <p>RESOLVED is only reachable through {@link #resolveDispute}. An illegal edge fails with
     * INVALID_STATE, a terminal dispute with CONFLICT.
     */
    @PostMapping("/{disputeId}/status")
    ResponseEntity<DisputeResponse> updateStatus(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid DisputeStatusUpdateRequest request);

    /**
     * Assigns the dispute to an officer. Admin only.
     */
    @PostMapping("/{disputeId}/assign")
    ResponseEntity<DisputeResponse> assignDispute(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid AssignDisputeRequest request);

    @PostMapping("/{disputeId}/resolve")
    ResponseEntity<DisputeResponse> resolveDispute(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid ResolveDisputeRequest request);

    @PostMapping("/{disputeId}/withdraw")
    ResponseEntity<DisputeResponse> withdrawDispute(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid ReasonRequest request);
}
