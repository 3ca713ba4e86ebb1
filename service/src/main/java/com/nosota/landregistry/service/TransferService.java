package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.model.ComplianceOutcome;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.model.TransferDocumentStatus;
import com.nosota.landregistry.api.model.TransferDocumentType;
import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.api.model.TransferType;
import com.nosota.landregistry.api.request.ComplianceCheckRequest;
import com.nosota.landregistry.api.request.InitiateTransferRequest;
import com.nosota.landregistry.api.request.TransferDocumentDecision;
import com.nosota.landregistry.api.request.TransferDocumentSubmission;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidStateException;
import com.nosota.landregistry.error.NotFoundException;
import com.nosota.landregistry.error.PreconditionFailedException;
import com.nosota.landregistry.error.WorkflowValidationException;
import com.nosota.landregistry.event.WorkflowEventPublisher;
import com.nosota.landregistry.model.OwnershipRecord;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.model.TimelineEntry;
import com.nosota.landregistry.model.Transfer;
import com.nosota.landregistry.model.TransferDocument;
import com.nosota.landregistry.repository.OwnershipRecordRepository;
import com.nosota.landregistry.repository.TransferDocumentRepository;
import com.nosota.landregistry.repository.TransferRepository;
import com.nosota.landregistry.security.AccessGuard;
import com.nosota.landregistry.security.Actor;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ownership transfer workflow of an approved property.
 *
 * <p>Transitions lock the transfer row first and, where the property changes too, the property
 * row second. {@link #completeTransfer(Actor, UUID)} writes both rows in one transaction, so the
 * new owner and the COMPLETED status are committed together or not at all.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    private static final Set<TransferStatus> FINAL_STATUSES = EnumSet.of(
            TransferStatus.REJECTED, TransferStatus.COMPLETED, TransferStatus.CANCELLED);

    /**
     * Document each transfer type needs besides the ID documents of both parties.
     */
    private static final Map<TransferType, TransferDocumentType> TYPE_SPECIFIC_DOCUMENT = new EnumMap<>(Map.of(
            TransferType.SALE, TransferDocumentType.SALE_AGREEMENT,
            TransferType.INHERITANCE, TransferDocumentType.INHERITANCE_CERTIFICATE,
            TransferType.COURT_ORDER, TransferDocumentType.COURT_ORDER
    ));

    private final TransferRepository transferRepository;
    private final TransferDocumentRepository transferDocumentRepository;
    private final OwnershipRecordRepository ownershipRecordRepository;
    private final PropertyApplicationService propertyApplicationService;
    private final TransferStatusStateMachine transferStatusStateMachine;
    private final FeeCalculationService feeCalculationService;
    private final WorkflowEventPublisher workflowEventPublisher;
    private final Clock clock;

    /**
     * Starts a transfer of an approved property to a new owner.
     *
     * @throws PreconditionFailedException if the property is not approved or has an active dispute
     * @throws ConflictException           if another transfer of the property is in progress
     * @throws WorkflowValidationException if the new owner is the current owner
     */
    @Transactional
    public Transfer initiateTransfer(@NotNull Actor actor, @NotNull InitiateTransferRequest request) {
        PropertyApplication property = propertyApplicationService.lockApplication(request.propertyId());
        AccessGuard.ownerOrAnyOf(property.getOwnerId(), ActorRole.LAND_OFFICER, ActorRole.ADMIN).check(actor);

        List<String> missing = new ArrayList<>();
        if (property.getStatus() != PropertyStatus.APPROVED) {
            missing.add("property registration is " + property.getStatus() + ", not APPROVED");
        }
        if (property.isHasActiveDispute()) {
            missing.add("property has an active dispute");
        }
        if (!missing.isEmpty()) {
            throw new PreconditionFailedException("initiate transfer of property " + property.getId(), missing);
        }

        if (property.getCurrentTransferId() != null
                || transferRepository.existsByPropertyIdAndStatusNotIn(property.getId(), FINAL_STATUSES)) {
            throw new ConflictException("Property " + property.getId() + " already has a transfer in progress");
        }
        if (Objects.equals(request.newOwnerId(), property.getOwnerId())) {
            throw new WorkflowValidationException("New owner must differ from the current owner");
        }

        LocalDateTime now = LocalDateTime.now(clock);

        Transfer transfer = new Transfer();
        transfer.setPropertyId(property.getId());
        transfer.setTransferType(request.transferType());
        transfer.setTransferReason(request.transferReason().trim());
        transfer.setPreviousOwnerId(property.getOwnerId());
        transfer.setNewOwnerId(request.newOwnerId());
        transfer.setTransferValueAmount(request.transferValueAmount() != null ? request.transferValueAmount() : BigDecimal.ZERO);
        transfer.setTransferValueCurrency(request.transferValueCurrency() != null
                ? request.transferValueCurrency() : feeCalculationService.currency());
        transfer.setInitiatedBy(actor.id());
        transfer.setInitiationDate(now);
        transfer.setStatus(TransferStatus.INITIATED);
        transfer.setLegalCompliance(ComplianceOutcome.PENDING);
        transfer.setTaxClearance(ComplianceOutcome.PENDING);
        transfer.setFraudScreening(ComplianceOutcome.PENDING);
        transfer.setCreatedAt(now);
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, "TRANSFER_INITIATED", transfer.getTransferReason(), actor, now);
        transfer = transferRepository.save(transfer);

        property.setCurrentTransferId(transfer.getId());
        property.setUpdatedAt(now);

        log.info("Transfer {} of property {} initiated by {}: {} → {}",
                transfer.getId(), property.getId(), actor, transfer.getPreviousOwnerId(), transfer.getNewOwnerId());
        publish(transfer, "TRANSFER_INITIATED", null, TransferStatus.INITIATED, actor, transfer.getTransferReason());
        return transfer;
    }

    /**
     * Adds documents from one of the parties and moves the transfer to DOCUMENTS_SUBMITTED.
     */
    @Transactional
    public Transfer submitTransferDocuments(@NotNull Actor actor, @NotNull UUID transferId,
                                            @NotNull List<TransferDocumentSubmission> documents) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.anyParty(transfer.getPreviousOwnerId(), transfer.getNewOwnerId()).check(actor);

        TransferStatus fromStatus = transfer.getStatus();
        if (fromStatus != TransferStatus.DOCUMENTS_SUBMITTED) {
            transferStatusStateMachine.validateTransition(fromStatus, TransferStatus.DOCUMENTS_SUBMITTED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        for (TransferDocumentSubmission submission : documents) {
            TransferDocument document = new TransferDocument();
            document.setTransferId(transferId);
            document.setSubmittedBy(actor.id());
            document.setDocumentType(submission.documentType());
            document.setFileName(submission.fileName());
            document.setFileSize(submission.fileSize());
            document.setMimeType(submission.mimeType());
            document.setStatus(TransferDocumentStatus.PENDING);
            document.setSubmittedAt(now);
            transferDocumentRepository.save(document);
        }

        String notes = documents.stream()
                .map(document -> document.documentType().name())
                .collect(Collectors.joining(", "));
        transfer.setStatus(TransferStatus.DOCUMENTS_SUBMITTED);
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, "DOCUMENTS_SUBMITTED", notes, actor, now);

        publish(transfer, "TRANSFER_DOCUMENTS_SUBMITTED", fromStatus, TransferStatus.DOCUMENTS_SUBMITTED, actor, notes);
        return transfer;
    }

    /**
     * Applies officer decisions to submitted documents.
     *
     * <p>Any rejection in the batch sends the transfer back to DOCUMENTS_PENDING. When nothing is
     * left pending and the verified documents cover the required set, the transfer moves to
     * UNDER_REVIEW. Otherwise it stays in DOCUMENTS_SUBMITTED.
     */
    @Transactional
    public Transfer reviewDocuments(@NotNull Actor actor, @NotNull UUID transferId,
                                    @NotNull List<TransferDocumentDecision> decisions) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.STAFF.check(actor);
        requireStatus(transfer, TransferStatus.DOCUMENTS_SUBMITTED, "review documents");

        Map<UUID, TransferDocument> documents = transferDocumentRepository
                .findByTransferIdOrderBySubmittedAtAsc(transferId).stream()
                .collect(Collectors.toMap(TransferDocument::getId, Function.identity()));

        LocalDateTime now = LocalDateTime.now(clock);
        boolean anyRejected = false;
        for (TransferDocumentDecision decision : decisions) {
            TransferDocument document = documents.get(decision.documentId());
            if (document == null) {
                throw new NotFoundException(String.format(
                        "Transfer document %s not found in transfer %s", decision.documentId(), transferId));
            }
            if (decision.status() == TransferDocumentStatus.PENDING) {
                throw new WorkflowValidationException("A document decision must be VERIFIED or REJECTED");
            }
            if (decision.status() == TransferDocumentStatus.REJECTED && (decision.notes() == null || decision.notes().isBlank())) {
                throw new WorkflowValidationException("Notes are required when rejecting transfer document " + document.getId());
            }
            document.setStatus(decision.status());
            document.setNotes(decision.notes());
            document.setReviewedBy(actor.id());
            document.setReviewedAt(now);
            anyRejected |= decision.status() == TransferDocumentStatus.REJECTED;
        }

        TransferStatus fromStatus = transfer.getStatus();
        TransferStatus toStatus = fromStatus;
        if (anyRejected) {
            toStatus = TransferStatus.DOCUMENTS_PENDING;
        } else if (documentsComplete(transfer, documents.values())) {
            toStatus = TransferStatus.UNDER_REVIEW;
        }
        if (toStatus != fromStatus) {
            transferStatusStateMachine.validateTransition(fromStatus, toStatus);
            transfer.setStatus(toStatus);
        }
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, "DOCUMENTS_REVIEWED",
                anyRejected ? "one or more documents rejected" : null, actor, now);

        publish(transfer, "TRANSFER_DOCUMENTS_REVIEWED", fromStatus, toStatus, actor, null);
        return transfer;
    }

    /**
     * Records the compliance checklist. Can be repeated while the transfer is in COMPLIANCE_CHECK.
     */
    @Transactional
    public Transfer performComplianceChecks(@NotNull Actor actor, @NotNull UUID transferId,
                                            @NotNull ComplianceCheckRequest request) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.STAFF.check(actor);

        TransferStatus fromStatus = transfer.getStatus();
        if (fromStatus != TransferStatus.COMPLIANCE_CHECK) {
            transferStatusStateMachine.validateTransition(fromStatus, TransferStatus.COMPLIANCE_CHECK);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        transfer.setLegalCompliance(request.legalCompliance());
        transfer.setTaxClearance(request.taxClearance());
        transfer.setFraudScreening(request.fraudScreening());
        transfer.setFraudRiskLevel(request.fraudRiskLevel());
        transfer.setComplianceNotes(request.notes());
        transfer.setComplianceCheckedBy(actor.id());
        transfer.setComplianceCheckedAt(now);
        transfer.setStatus(TransferStatus.COMPLIANCE_CHECK);
        transfer.setUpdatedAt(now);

        String summary = String.format("legal=%s, tax=%s, fraud=%s",
                request.legalCompliance(), request.taxClearance(), request.fraudScreening());
        appendTimeline(transfer, "COMPLIANCE_CHECKED", summary, actor, now);

        publish(transfer, "TRANSFER_COMPLIANCE_CHECKED", fromStatus, TransferStatus.COMPLIANCE_CHECK, actor, summary);
        return transfer;
    }

    /**
     * Approves a transfer whose compliance checks all passed and whose fee is paid. The approver
     * must not be a party of the transfer.
     */
    @Transactional
    public Transfer approveTransfer(@NotNull Actor actor, @NotNull UUID transferId, String notes) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.STAFF.and(notParty(transfer)).check(actor);

        TransferStatus fromStatus = transfer.getStatus();
        transferStatusStateMachine.validateTransition(fromStatus, TransferStatus.APPROVED);

        List<String> missing = new ArrayList<>();
        if (!transfer.allComplianceChecksPassed()) {
            missing.add("compliance checks not all passed");
        }
        if (!transfer.isFeePaid()) {
            missing.add("transfer fee not yet paid");
        }
        if (!missing.isEmpty()) {
            throw new PreconditionFailedException("approve transfer " + transferId, missing);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        transfer.setStatus(TransferStatus.APPROVED);
        transfer.setReviewedBy(actor.id());
        transfer.setReviewNotes(notes);
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, "TRANSFER_APPROVED", notes, actor, now);

        log.info("Transfer {} approved by {}", transferId, actor);
        publish(transfer, "TRANSFER_APPROVED", fromStatus, TransferStatus.APPROVED, actor, notes);
        return transfer;
    }

    @Transactional
    public Transfer rejectTransfer(@NotNull Actor actor, @NotNull UUID transferId, String reason) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.STAFF.check(actor);
        return abort(actor, transfer, TransferStatus.REJECTED, reason, "TRANSFER_REJECTED");
    }

    /**
     * Withdraws a transfer before completion. Only the current owner who initiated it, or an admin.
     */
    @Transactional
    public Transfer cancelTransfer(@NotNull Actor actor, @NotNull UUID transferId, String reason) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.owner(transfer.getPreviousOwnerId()).or(AccessGuard.ADMIN).check(actor);
        return abort(actor, transfer, TransferStatus.CANCELLED, reason, "TRANSFER_CANCELLED");
    }

    /**
     * Completes an approved transfer: closes the outgoing owner's period in the ownership history,
     * hands the property to the new owner and marks the transfer COMPLETED.
     *
     * <p>Both rows are locked, transfer first. Of two concurrent completions, the second one
     * finds the transfer COMPLETED and fails with a conflict.
     *
     * @throws ConflictException     if the transfer is already completed
     * @throws InvalidStateException if the transfer is not approved
     */
    @Transactional
    public Transfer completeTransfer(@NotNull Actor actor, @NotNull UUID transferId) {
        Transfer transfer = lockTransfer(transferId);
        AccessGuard.ADMIN.check(actor);

        if (transfer.getStatus() == TransferStatus.COMPLETED) {
            throw new ConflictException("Transfer " + transferId + " is already COMPLETED");
        }
        if (transfer.getStatus() != TransferStatus.APPROVED) {
            throw new InvalidStateException(String.format(
                    "Transfer %s must be APPROVED to complete, current status: %s", transferId, transfer.getStatus()));
        }

        PropertyApplication property = propertyApplicationService.lockApplication(transfer.getPropertyId());
        if (!Objects.equals(property.getOwnerId(), transfer.getPreviousOwnerId())) {
            throw new ConflictException(String.format(
                    "Owner of property %s changed since transfer %s was initiated", property.getId(), transferId));
        }

        LocalDateTime now = LocalDateTime.now(clock);

        OwnershipRecord record = new OwnershipRecord();
        record.setPropertyId(property.getId());
        record.setOwnerId(property.getOwnerId());
        record.setStartDate(property.getOwnerSince());
        record.setEndDate(now);
        record.setAcquisitionType(transfer.getTransferType());
        record.setTransferId(transferId);
        ownershipRecordRepository.save(record);

        property.setOwnerId(transfer.getNewOwnerId());
        property.setOwnerSince(now);
        if (transferId.equals(property.getCurrentTransferId())) {
            property.setCurrentTransferId(null);
        }
        property.setUpdatedAt(now);

        transferStatusStateMachine.validateTransition(TransferStatus.APPROVED, TransferStatus.COMPLETED);
        transfer.setStatus(TransferStatus.COMPLETED);
        transfer.setCompletionDate(now);
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, "TRANSFER_COMPLETED", null, actor, now);

        log.info("Transfer {} completed by {}: property {} now owned by {}",
                transferId, actor, property.getId(), transfer.getNewOwnerId());
        publish(transfer, "TRANSFER_COMPLETED", TransferStatus.APPROVED, TransferStatus.COMPLETED, actor, null);
        workflowEventPublisher.publish(AuditEntityType.PROPERTY, property.getId(), property.getId(),
                "OWNERSHIP_TRANSFERRED", property.getStatus(), property.getStatus(), actor,
                String.format("owner %d → %d", transfer.getPreviousOwnerId(), transfer.getNewOwnerId()));
        return transfer;
    }

    /**
     * Marks the transfer fee as paid, advancing an INITIATED transfer to DOCUMENTS_PENDING.
     * Caller must hold the transfer lock.
     */
    public void recordFeePaid(Transfer transfer, Actor actor) {
        LocalDateTime now = LocalDateTime.now(clock);
        transfer.setFeePaid(true);
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, "TRANSFER_FEE_PAID", null, actor, now);

        if (transfer.getStatus() == TransferStatus.INITIATED) {
            transferStatusStateMachine.validateTransition(TransferStatus.INITIATED, TransferStatus.DOCUMENTS_PENDING);
            transfer.setStatus(TransferStatus.DOCUMENTS_PENDING);
            publish(transfer, "TRANSFER_FEE_PAID", TransferStatus.INITIATED, TransferStatus.DOCUMENTS_PENDING, actor, null);
        } else {
            publish(transfer, "TRANSFER_FEE_PAID", transfer.getStatus(), transfer.getStatus(), actor, null);
        }
    }

    public Transfer getTransfer(@NotNull Actor actor, @NotNull UUID transferId) {
        Transfer transfer = findTransfer(transferId);
        readGuard(transfer).check(actor);
        return transfer;
    }

    public Page<Transfer> listTransfers(@NotNull Actor actor, TransferStatus status, int page, int size) {
        AccessGuard.STAFF.check(actor);
        PageRequest pageable = PageRequest.of(page, size);
        return status != null
                ? transferRepository.findByStatusOrderByCreatedAtDesc(status, pageable)
                : transferRepository.findAllByOrderByCreatedAtDesc(pageable);
    }

    public Page<Transfer> listMyTransfers(@NotNull Actor actor, int page, int size) {
        return transferRepository.findByParty(actor.id(), PageRequest.of(page, size));
    }

    public List<Transfer> listPropertyTransfers(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication property = propertyApplicationService.findApplication(propertyId);
        AccessGuard.ownerOrAnyOf(property.getOwnerId(), ActorRole.LAND_OFFICER, ActorRole.ADMIN).check(actor);
        return transferRepository.findByPropertyIdOrderByCreatedAtDesc(propertyId);
    }

    public List<TransferDocument> documentsOf(UUID transferId) {
        return transferDocumentRepository.findByTransferIdOrderBySubmittedAtAsc(transferId);
    }

    public Transfer lockTransfer(UUID transferId) {
        return transferRepository.getOneForUpdate(transferId)
                .orElseThrow(() -> NotFoundException.of("Transfer", transferId));
    }

    public Transfer findTransfer(UUID transferId) {
        return transferRepository.findById(transferId)
                .orElseThrow(() -> NotFoundException.of("Transfer", transferId));
    }

    /**
     * Parties of the transfer, plus staff.
     */
    public static AccessGuard readGuard(Transfer transfer) {
        return AccessGuard.anyParty(transfer.getPreviousOwnerId(), transfer.getNewOwnerId()).or(AccessGuard.STAFF);
    }

    private Transfer abort(Actor actor, Transfer transfer, TransferStatus toStatus, String reason, String action) {
        if (reason == null || reason.isBlank()) {
            throw new WorkflowValidationException("A reason is required to " +
                    (toStatus == TransferStatus.REJECTED ? "reject" : "cancel") + " a transfer");
        }
        TransferStatus fromStatus = transfer.getStatus();
        transferStatusStateMachine.validateTransition(fromStatus, toStatus);

        PropertyApplication property = propertyApplicationService.lockApplication(transfer.getPropertyId());
        LocalDateTime now = LocalDateTime.now(clock);

        if (transfer.getId().equals(property.getCurrentTransferId())) {
            property.setCurrentTransferId(null);
            property.setUpdatedAt(now);
        }

        transfer.setStatus(toStatus);
        transfer.setRejectionReason(reason.trim());
        transfer.setReviewedBy(actor.id());
        transfer.setUpdatedAt(now);
        appendTimeline(transfer, action, reason.trim(), actor, now);

        log.info("Transfer {} {} by {}: {}", transfer.getId(), toStatus, actor, reason);
        publish(transfer, action, fromStatus, toStatus, actor, reason.trim());
        return transfer;
    }

    private boolean documentsComplete(Transfer transfer, Collection<TransferDocument> documents) {
        if (documents.stream().anyMatch(document -> document.getStatus() == TransferDocumentStatus.PENDING)) {
            return false;
        }
        List<TransferDocument> verified = documents.stream()
                .filter(document -> document.getStatus() == TransferDocumentStatus.VERIFIED)
                .toList();

        boolean sellerId = verified.stream().anyMatch(document ->
                document.getDocumentType() == TransferDocumentType.ID_DOCUMENTS
                        && transfer.getPreviousOwnerId().equals(document.getSubmittedBy()));
        boolean buyerId = verified.stream().anyMatch(document ->
                document.getDocumentType() == TransferDocumentType.ID_DOCUMENTS
                        && transfer.getNewOwnerId().equals(document.getSubmittedBy()));

        TransferDocumentType specific = TYPE_SPECIFIC_DOCUMENT.get(transfer.getTransferType());
        boolean specificPresent = specific == null
                || verified.stream().anyMatch(document -> document.getDocumentType() == specific);

        return sellerId && buyerId && specificPresent;
    }

    private void requireStatus(Transfer transfer, TransferStatus expected, String operation) {
        if (transferStatusStateMachine.isFinalState(transfer.getStatus())) {
            throw new ConflictException(String.format("Transfer %s is already %s", transfer.getId(), transfer.getStatus()));
        }
        if (transfer.getStatus() != expected) {
            throw new InvalidStateException(String.format("Cannot %s: transfer %s is %s, expected %s",
                    operation, transfer.getId(), transfer.getStatus(), expected));
        }
    }

    private static AccessGuard notParty(Transfer transfer) {
        return AccessGuard.of("not being a party of the transfer", actor -> !transfer.isParty(actor.id()));
    }

    private static void appendTimeline(Transfer transfer, String action, String notes, Actor actor, LocalDateTime at) {
        transfer.getTimeline().add(new TimelineEntry(action, notes, actor.id(), actor.role(), at));
    }

    private void publish(Transfer transfer, String action, TransferStatus fromStatus, TransferStatus toStatus,
                         Actor actor, String notes) {
        workflowEventPublisher.publish(AuditEntityType.TRANSFER, transfer.getId(), transfer.getPropertyId(),
                action, fromStatus, toStatus, actor, notes);
    }
}
