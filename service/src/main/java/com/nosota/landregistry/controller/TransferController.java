package com.nosota.landregistry.controller;

import com.nosota.landregistry.api.TransferApi;
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
import com.nosota.landregistry.dto.TransferMapper;
import com.nosota.landregistry.model.Transfer;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.TransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for ownership transfers.
 *
 * <p>Implements {@link TransferApi}. Every response carries the transfer's timeline and the
 * documents submitted by the parties.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class TransferController implements TransferApi {

    private final TransferService transferService;

    @Override
    public ResponseEntity<TransferResponse> initiateTransfer(Long actorId, ActorRole actorRole,
                                                             InitiateTransferRequest request) {
        log.info("Initiating {} transfer of property {} to owner {} by {}",
                request.transferType(), request.propertyId(), request.newOwnerId(), actorId);

        Transfer transfer = transferService.initiateTransfer(Actor.of(actorId, actorRole), request);

        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(transfer));
    }

    @Override
    public ResponseEntity<TransferResponse> getTransfer(Long actorId, ActorRole actorRole, UUID transferId) {
        return ResponseEntity.ok(toResponse(transferService.getTransfer(Actor.of(actorId, actorRole), transferId)));
    }

    @Override
    public ResponseEntity<PagedResponse<TransferResponse>> listTransfers(Long actorId, ActorRole actorRole,
                                                                         TransferStatus status, int page, int size) {
        return ResponseEntity.ok(toPagedResponse(
                transferService.listTransfers(Actor.of(actorId, actorRole), status, page, size)));
    }

    @Override
    public ResponseEntity<PagedResponse<TransferResponse>> listMyTransfers(Long actorId, ActorRole actorRole,
                                                                           int page, int size) {
        return ResponseEntity.ok(toPagedResponse(
                transferService.listMyTransfers(Actor.of(actorId, actorRole), page, size)));
    }

    @Override
    public ResponseEntity<List<TransferResponse>> listPropertyTransfers(Long actorId, ActorRole actorRole,
                                                                        UUID propertyId) {
        return ResponseEntity.ok(transferService.listPropertyTransfers(Actor.of(actorId, actorRole), propertyId).stream()
                .map(this::toResponse)
                .toList());
    }

    @Override
    public ResponseEntity<TransferResponse> submitTransferDocuments(Long actorId, ActorRole actorRole, UUID transferId,
                                                                    SubmitTransferDocumentsRequest request) {
        log.info("Submitting {} documents for transfer {} by {}", request.documents().size(), transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.submitTransferDocuments(
                Actor.of(actorId, actorRole), transferId, request.documents())));
    }

    @Override
    public ResponseEntity<TransferResponse> reviewDocuments(Long actorId, ActorRole actorRole, UUID transferId,
                                                            ReviewTransferDocumentsRequest request) {
        log.info("Reviewing {} documents of transfer {} by {}", request.decisions().size(), transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.reviewDocuments(
                Actor.of(actorId, actorRole), transferId, request.decisions())));
    }

    @Override
    public ResponseEntity<TransferResponse> performComplianceChecks(Long actorId, ActorRole actorRole, UUID transferId,
                                                                    ComplianceCheckRequest request) {
        log.info("Recording compliance checks for transfer {} by {}", transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.performComplianceChecks(
                Actor.of(actorId, actorRole), transferId, request)));
    }

    @Override
    public ResponseEntity<TransferResponse> approveTransfer(Long actorId, ActorRole actorRole, UUID transferId,
                                                            NotesRequest request) {
        log.info("Approving transfer {} by {}", transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.approveTransfer(
                Actor.of(actorId, actorRole), transferId, request.notes())));
    }

    @Override
    public ResponseEntity<TransferResponse> rejectTransfer(Long actorId, ActorRole actorRole, UUID transferId,
                                                           ReasonRequest request) {
        log.info("Rejecting transfer {} by {}", transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.rejectTransfer(
                Actor.of(actorId, actorRole), transferId, request.reason())));
    }

    @Override
    public ResponseEntity<TransferResponse> cancelTransfer(Long actorId, ActorRole actorRole, UUID transferId,
                                                           ReasonRequest request) {
        log.info("Cancelling transfer {} by {}", transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.cancelTransfer(
                Actor.of(actorId, actorRole), transferId, request.reason())));
    }

    @Override
    public ResponseEntity<TransferResponse> completeTransfer(Long actorId, ActorRole actorRole, UUID transferId) {
        log.info("Completing transfer {} by {}", transferId, actorId);
        return ResponseEntity.ok(toResponse(transferService.completeTransfer(Actor.of(actorId, actorRole), transferId)));
    }

    private TransferResponse toResponse(Transfer transfer) {
        return TransferMapper.INSTANCE.toResponse(transfer, transferService.documentsOf(transfer.getId()));
    }

    private PagedResponse<TransferResponse> toPagedResponse(Page<Transfer> page) {
        return new PagedResponse<>(
                page.getContent().stream().map(this::toResponse).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
