package com.nosota.landregistry.controller;

import com.nosota.landregistry.api.DocumentApi;
import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.request.DocumentDecisionRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReplaceDocumentRequest;
import com.nosota.landregistry.api.request.UploadDocumentRequest;
import com.nosota.landregistry.api.response.DocumentResponse;
import com.nosota.landregistry.dto.DocumentMapper;
import com.nosota.landregistry.model.Document;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.DocumentVerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class DocumentController implements DocumentApi {

    private final DocumentVerificationService documentVerificationService;

    @Override
    public ResponseEntity<DocumentResponse> uploadDocument(Long actorId, ActorRole actorRole, UUID propertyId,
                                                           UploadDocumentRequest request) {
        log.info("Uploading {} for application {}: file={}, size={}",
                request.documentType(), propertyId, request.fileName(), request.fileSize());

        Document document = documentVerificationService.uploadDocument(Actor.of(actorId, actorRole), propertyId, request);

        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentMapper.INSTANCE.toResponse(document));
    }

    @Override
    public ResponseEntity<List<DocumentResponse>> listDocuments(Long actorId, ActorRole actorRole, UUID propertyId) {
        return ResponseEntity.ok(DocumentMapper.INSTANCE.toResponseList(
                documentVerificationService.listDocuments(Actor.of(actorId, actorRole), propertyId)));
    }

    @Override
    public ResponseEntity<PagedResponse<DocumentResponse>> listPendingDocuments(Long actorId, ActorRole actorRole,
                                                                                int page, int size) {
        Page<Document> documents =
                documentVerificationService.listPendingDocuments(Actor.of(actorId, actorRole), page, size);
        return ResponseEntity.ok(new PagedResponse<>(
                DocumentMapper.INSTANCE.toResponseList(documents.getContent()),
                documents.getNumber(),
                documents.getSize(),
                documents.getTotalElements()));
    }

    @Override
    public ResponseEntity<DocumentResponse> getDocument(Long actorId, ActorRole actorRole, UUID documentId) {
        return ResponseEntity.ok(DocumentMapper.INSTANCE.toResponse(
                documentVerificationService.getDocument(Actor.of(actorId, actorRole), documentId)));
    }

    @Override
    public ResponseEntity<DocumentResponse> verifyDocument(Long actorId, ActorRole actorRole, UUID documentId,
                                                           DocumentDecisionRequest request) {
        log.info("Verifying document {} by {} (reverify={})", documentId, actorId, request.reverify());
        return ResponseEntity.ok(DocumentMapper.INSTANCE.toResponse(
                documentVerificationService.verifyDocument(Actor.of(actorId, actorRole), documentId, request)));
    }

    @Override
    public ResponseEntity<DocumentResponse> rejectDocument(Long actorId, ActorRole actorRole, UUID documentId,
                                                           DocumentDecisionRequest request) {
        log.info("Rejecting document {} by {} (reverify={})", documentId, actorId, request.reverify());
        return ResponseEntity.ok(DocumentMapper.INSTANCE.toResponse(
                documentVerificationService.rejectDocument(Actor.of(actorId, actorRole), documentId, request)));
    }

    @Override
    public ResponseEntity<DocumentResponse> requestDocumentUpdate(Long actorId, ActorRole actorRole, UUID documentId,
                                                                  NotesRequest request) {
        return ResponseEntity.ok(DocumentMapper.INSTANCE.toResponse(
                documentVerificationService.requestDocumentUpdate(Actor.of(actorId, actorRole), documentId, request.notes())));
    }

    @Override
    public ResponseEntity<DocumentResponse> replaceDocument(Long actorId, ActorRole actorRole, UUID documentId,
                                                            ReplaceDocumentRequest request) {
        log.info("Replacing file of document {}: file={}", documentId, request.fileName());
        return ResponseEntity.ok(DocumentMapper.INSTANCE.toResponse(
                documentVerificationService.replaceDocument(Actor.of(actorId, actorRole), documentId, request)));
    }
}
