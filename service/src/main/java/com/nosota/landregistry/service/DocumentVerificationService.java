package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.api.request.DocumentDecisionRequest;
import com.nosota.landregistry.api.request.ReplaceDocumentRequest;
import com.nosota.landregistry.api.request.UploadDocumentRequest;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.NotFoundException;
import com.nosota.landregistry.error.WorkflowValidationException;
import com.nosota.landregistry.event.WorkflowEventPublisher;
import com.nosota.landregistry.model.Document;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.repository.DocumentRepository;
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

import java.time.LocalDateTime;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Document sub-workflow of a property application.
 *
 * <p>Every transition locks the owning application first and the document second, then
 * recomputes the application's {@code documentsValidated} flag before committing.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DocumentVerificationService {

    private final DocumentRepository documentRepository;
    private final PropertyApplicationService propertyApplicationService;
    private final DocumentStatusStateMachine documentStatusStateMachine;
    private final WorkflowEventPublisher workflowEventPublisher;
    private final Clock clock;

    /**
     * Records the metadata of a document uploaded by the application owner. The file itself is
     * stored outside the registry.
     *
     * @throws com.nosota.landregistry.error.ForbiddenOperationException if the caller does not own the application
     * @throws ConflictException if the application is already approved or rejected
     */
    @Transactional
    public Document uploadDocument(@NotNull Actor actor, @NotNull UUID propertyId,
                                   @NotNull UploadDocumentRequest request) {
        PropertyApplication application = propertyApplicationService.lockApplication(propertyId);
        AccessGuard.owner(application.getOwnerId()).check(actor);
        requireOpen(application);

        LocalDateTime now = LocalDateTime.now(clock);

        Document document = new Document();
        document.setPropertyId(propertyId);
        document.setOwnerId(application.getOwnerId());
        document.setDocumentType(request.documentType());
        document.setFileName(request.fileName());
        document.setFileSize(request.fileSize());
        document.setMimeType(request.mimeType());
        document.setStatus(DocumentStatus.PENDING);
        document.setFileVersion(1);
        document.setUploadedAt(now);
        document.setUpdatedAt(now);
        document = documentRepository.save(document);

        log.info("Document {} ({}) uploaded for application {}", document.getId(), request.documentType(), propertyId);
        workflowEventPublisher.publish(AuditEntityType.DOCUMENT, document.getId(), propertyId,
                "DOCUMENT_UPLOADED", null, DocumentStatus.PENDING, actor, request.fileName());

        // A new pending document of a required type revokes a previous validation.
        propertyApplicationService.refreshAggregate(application);
        return document;
    }

    @Transactional
    public Document verifyDocument(@NotNull Actor actor, @NotNull UUID documentId,
                                   @NotNull DocumentDecisionRequest request) {
        return decide(actor, documentId, DocumentStatus.VERIFIED, request.notes(), request.reverify(),
                "DOCUMENT_VERIFIED");
    }

    /**
     * @throws WorkflowValidationException if no notes are given
     */
    @Transactional
    public Document rejectDocument(@NotNull Actor actor, @NotNull UUID documentId,
                                   @NotNull DocumentDecisionRequest request) {
        return decide(actor, documentId, DocumentStatus.REJECTED, request.notes(), request.reverify(),
                "DOCUMENT_REJECTED");
    }

    /**
     * Asks the owner for a corrected file.
     *
     * @throws WorkflowValidationException if no notes are given
     */
    @Transactional
    public Document requestDocumentUpdate(@NotNull Actor actor, @NotNull UUID documentId, String notes) {
        return decide(actor, documentId, DocumentStatus.NEEDS_UPDATE, notes, false, "DOCUMENT_UPDATE_REQUESTED");
    }

    /**
     * Replaces the file of a document that is pending, needs an update or was rejected. The document
     * goes back to PENDING with its file version incremented.
     */
    @Transactional
    public Document replaceDocument(@NotNull Actor actor, @NotNull UUID documentId,
                                    @NotNull ReplaceDocumentRequest request) {
        PropertyApplication application = lockOwningApplication(documentId);
        Document document = lockDocument(documentId);
        AccessGuard.owner(application.getOwnerId()).check(actor);
        requireOpen(application);

        DocumentStatus fromStatus = document.getStatus();
        documentStatusStateMachine.validateReplacement(fromStatus);

        document.setFileName(request.fileName());
        document.setFileSize(request.fileSize());
        document.setMimeType(request.mimeType());
        document.setFileVersion(document.getFileVersion() + 1);
        document.setStatus(DocumentStatus.PENDING);
        document.setNotes(null);
        document.setReviewedBy(null);
        document.setReviewedAt(null);
        document.setUpdatedAt(LocalDateTime.now(clock));

        log.info("Document {} replaced with version {}", documentId, document.getFileVersion());
        workflowEventPublisher.publish(AuditEntityType.DOCUMENT, documentId, application.getId(),
                "DOCUMENT_REPLACED", fromStatus, DocumentStatus.PENDING, actor,
                "version " + document.getFileVersion());

        propertyApplicationService.refreshAggregate(application);
        return document;
    }

    public Document getDocument(@NotNull Actor actor, @NotNull UUID documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.of("Document", documentId));
        readGuard(document.getOwnerId()).check(actor);
        return document;
    }

    public List<Document> listDocuments(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = propertyApplicationService.findApplication(propertyId);
        readGuard(application.getOwnerId()).check(actor);
        return documentRepository.findByPropertyIdOrderByUploadedAtAsc(propertyId);
    }

    /**
     * Officer work queue: PENDING documents, oldest upload first.
     */
    public Page<Document> listPendingDocuments(@NotNull Actor actor, int page, int size) {
        AccessGuard.STAFF.check(actor);
        return documentRepository.findByStatusOrderByUploadedAtAsc(DocumentStatus.PENDING, PageRequest.of(page, size));
    }

    private Document decide(Actor actor, UUID documentId, DocumentStatus toStatus, String notes,
                            boolean reverify, String action) {
        PropertyApplication application = lockOwningApplication(documentId);
        Document document = lockDocument(documentId);
        AccessGuard.STAFF.check(actor);

        if (toStatus != DocumentStatus.VERIFIED && (notes == null || notes.isBlank())) {
            throw new WorkflowValidationException("Notes are required when a document is " +
                    (toStatus == DocumentStatus.REJECTED ? "rejected" : "sent back for an update"));
        }
        requireOpen(application);

        DocumentStatus fromStatus = document.getStatus();
        documentStatusStateMachine.validateDecision(fromStatus, toStatus, reverify);

        LocalDateTime now = LocalDateTime.now(clock);
        document.setStatus(toStatus);
        document.setNotes(notes);
        document.setReviewedBy(actor.id());
        document.setReviewedAt(now);
        document.setUpdatedAt(now);

        log.info("Document {} of application {}: {} → {} by {}",
                documentId, application.getId(), fromStatus, toStatus, actor);
        workflowEventPublisher.publish(AuditEntityType.DOCUMENT, documentId, application.getId(),
                action, fromStatus, toStatus, actor, notes);

        propertyApplicationService.markReviewStarted(application);
        propertyApplicationService.refreshAggregate(application);
        return document;
    }

    private PropertyApplication lockOwningApplication(UUID documentId) {
        UUID propertyId = documentRepository.findPropertyIdById(documentId)
                .orElseThrow(() -> NotFoundException.of("Document", documentId));
        return propertyApplicationService.lockApplication(propertyId);
    }

    private Document lockDocument(UUID documentId) {
        return documentRepository.getOneForUpdate(documentId)
                .orElseThrow(() -> NotFoundException.of("Document", documentId));
    }

    private static void requireOpen(PropertyApplication application) {
        if (application.getStatus().isTerminal()) {
            throw new ConflictException(String.format(
                    "Property application %s is already %s, its documents can no longer change",
                    application.getId(), application.getStatus()));
        }
    }

    private static AccessGuard readGuard(Long ownerId) {
        return AccessGuard.ownerOrAnyOf(ownerId, ActorRole.LAND_OFFICER, ActorRole.ADMIN);
    }
}
