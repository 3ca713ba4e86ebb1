package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.request.DocumentDecisionRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReplaceDocumentRequest;
import com.nosota.landregistry.api.request.UploadDocumentRequest;
import com.nosota.landregistry.api.response.DocumentResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Document verification API.
 *
 * <p>Owners upload and replace document metadata. Land officers and admins verify, reject or
 * ask for an update. Every decision recomputes the owning application's documents flag.
 */
@RequestMapping("/api/v1/documents")
public interface DocumentApi {

    /**
     * Registers a document for a property application in PENDING status. Owner only.
     *
     * @param propertyId Owning application
     * @param request    File metadata
     * @return Created document
     */
    @PostMapping("/properties/{propertyId}")
    ResponseEntity<DocumentResponse> uploadDocument(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId,
            @RequestBody @Valid UploadDocumentRequest request);

    @GetMapping("/properties/{propertyId}")
    ResponseEntity<List<DocumentResponse>> listDocuments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    /**
     * Documents waiting for an officer decision, oldest first. Land officers and admins only.
     */
    @GetMapping("/pending")
    ResponseEntity<PagedResponse<DocumentResponse>> listPendingDocuments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    @GetMapping("/{documentId}")
    ResponseEntity<DocumentResponse> getDocument(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("documentId") UUID documentId);

    /**
     * Marks a document VERIFIED.
     *
     * <p>A document already VERIFIED or REJECTED fails with CONFLICT unless
     * {@code reverify} is set.
     */
    @PostMapping("/{documentId}/verify")
    ResponseEntity<DocumentResponse> verifyDocument(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("documentId") UUID documentId,
            @RequestBody @Valid DocumentDecisionRequest request);

    /**
     * Marks a document REJECTED. Notes are mandatory.
     */
    @PostMapping("/{documentId}/reject")
    ResponseEntity<DocumentResponse> rejectDocument(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("documentId") UUID documentId,
            @RequestBody @Valid DocumentDecisionRequest request);

    @PostMapping("/{documentId}/request-update")
    ResponseEntity<DocumentResponse> requestDocumentUpdate(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("documentId") UUID documentId,
            @RequestBody @Valid NotesRequest request);

    /**
     * Replaces the file behind a document and puts it back to PENDING. Owner only.
     */
    @PutMapping("/{documentId}/file")
    ResponseEntity<DocumentResponse> replaceDocument(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("documentId") UUID documentId,
            @RequestBody @Valid ReplaceDocumentRequest request);
}
