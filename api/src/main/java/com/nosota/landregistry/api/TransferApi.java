package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.api.request.ComplianceCheckRequest;
import com.nosota.landregistry.api.request.InitiateTransferRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.ReviewTransferDocumentsRequest;
import com.nosota.landregistry.api.request.SubmitTransferDocumentsRequest;
import com.nosota.landregistry.api.response.TransferResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Ownership transfer API.
 *
 * <p>Transfer lifecycle:
 * <pre>
 * INITIATED -> DOCUMENTS_PENDING -> DOCUMENTS_SUBMITTED -> UNDER_REVIEW
 *           -> COMPLIANCE_CHECK -> APPROVED -> COMPLETED
 * </pre>
 * REJECTED and CANCELLED are reachable from every state before COMPLETED.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>TransferController - in service module (server-side implementation)</li>
 *   <li>TransferClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/transfers")
public interface TransferApi {

    /**
     * Initiates a transfer of an APPROVED property.
     *
     * <p>Fails with PRECONDITION_FAILED when the property is not approved or has an active
     * dispute, and with CONFLICT when another transfer is already active.
     *
     * @param request Property, type, new owner, value and reason
     * @return Created transfer in INITIATED status
     */
    @PostMapping
    ResponseEntity<TransferResponse> initiateTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid InitiateTransferRequest request);

    @GetMapping("/{transferId}")
    ResponseEntity<TransferResponse> getTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId);

    /**
     * Lists all transfers, optionally filtered by status. Land officers and admins only.
     */
    @GetMapping
    ResponseEntity<PagedResponse<TransferResponse>> listTransfers(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "status", required = false) TransferStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Lists transfers where the caller is the previous or the new owner.
     */
    @GetMapping("/mine")
    ResponseEntity<PagedResponse<TransferResponse>> listMyTransfers(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    @GetMapping("/properties/{propertyId}")
    ResponseEntity<List<TransferResponse>> listPropertyTransfers(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    /**
     * Submits documents on behalf of one of the parties.
     */
    @PostMapping("/{transferId}/documents")
    ResponseEntity<TransferResponse> submitTransferDocuments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId,
            @RequestBody @Valid SubmitTransferDocumentsRequest request);

    /**
     * Records officer decisions on the submitted documents.
     *
     * <p>Any rejection sends the transfer back to DOCUMENTS_PENDING. A complete, fully
     * verified set moves it to UNDER_REVIEW.
     */
    @PostMapping("/{transferId}/documents/review")
    ResponseEntity<TransferResponse> reviewDocuments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId,
            @RequestBody @Valid ReviewTransferDocumentsRequest request);

    @PostMapping("/{transferId}/compliance")
    ResponseEntity<TransferResponse> performComplianceChecks(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId,
            @RequestBody @Valid ComplianceCheckRequest request);

    /**
     * Approves a transfer in COMPLIANCE_CHECK once every check passed and the fee is paid.
     */
    @PostMapping("/{transferId}/approve")
    ResponseEntity<TransferResponse> approveTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId,
            @RequestBody @Valid NotesRequest request);

    @PostMapping("/{transferId}/reject")
    ResponseEntity<TransferResponse> rejectTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId,
            @RequestBody @Valid ReasonRequest request);

    @PostMapping("/{transferId}/cancel")
    ResponseEntity<TransferResponse> cancelTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId,
            @RequestBody @Valid ReasonRequest request);

    /**
     * Completes an APPROVED transfer and reassigns the property owner. Admin only.
     *
     * <p>Ownership reassignment and the transfer status change commit together or not at all.
     *
     * @param transferId The transfer ID
     * @return Completed transfer
     */
    @PostMapping("/{transferId}/complete")
    ResponseEntity<TransferResponse> completeTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId);
}
