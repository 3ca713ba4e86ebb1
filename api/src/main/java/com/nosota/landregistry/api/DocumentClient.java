package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.request.DocumentDecisionRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReplaceDocumentRequest;
import com.nosota.landregistry.api.request.UploadDocumentRequest;
import com.nosota.landregistry.api.response.DocumentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of DocumentApi. Not a Spring bean, see {@link PropertyClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class DocumentClient implements DocumentApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<DocumentResponse> uploadDocument(Long actorId, ActorRole actorRole, UUID propertyId,
                                                           UploadDocumentRequest request) {
        log.debug("Calling uploadDocument: propertyId={}, type={}", propertyId, request.documentType());

        return webClient.post()
                .uri("/api/v1/documents/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DocumentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<DocumentResponse>> listDocuments(Long actorId, ActorRole actorRole, UUID propertyId) {
        log.debug("Calling listDocuments: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/documents/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<DocumentResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<DocumentResponse>> listPendingDocuments(Long actorId, ActorRole actorRole,
                                                                                int page, int size) {
        log.debug("Calling listPendingDocuments: page={}, size={}", page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/documents/pending")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<DocumentResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<DocumentResponse> getDocument(Long actorId, ActorRole actorRole, UUID documentId) {
        log.debug("Calling getDocument: documentId={}", documentId);

        return webClient.get()
                .uri("/api/v1/documents/{documentId}", documentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(DocumentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DocumentResponse> verifyDocument(Long actorId, ActorRole actorRole, UUID documentId,
                                                           DocumentDecisionRequest request) {
        log.debug("Calling verifyDocument: documentId={}, reverify={}", documentId, request.reverify());

        return webClient.post()
                .uri("/api/v1/documents/{documentId}/verify", documentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DocumentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DocumentResponse> rejectDocument(Long actorId, ActorRole actorRole, UUID documentId,
                                                           DocumentDecisionRequest request) {
        log.debug("Calling rejectDocument: documentId={}, reverify={}", documentId, request.reverify());

        return webClient.post()
                .uri("/api/v1/documents/{documentId}/reject", documentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DocumentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DocumentResponse> requestDocumentUpdate(Long actorId, ActorRole actorRole,
                                                                  UUID documentId, NotesRequest request) {
        log.debug("Calling requestDocumentUpdate: documentId={}", documentId);

        return webClient.post()
                .uri("/api/v1/documents/{documentId}/request-update", documentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DocumentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DocumentResponse> replaceDocument(Long actorId, ActorRole actorRole, UUID documentId,
                                                            ReplaceDocumentRequest request) {
        log.debug("Calling replaceDocument: documentId={}, fileName={}", documentId, request.fileName());

        return webClient.put()
                .uri("/api/v1/documents/{documentId}/file", documentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DocumentResponse.class)
                .block();
    }
}
