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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * WebClient-based implementation of TransferApi. Not a Spring bean, see {@link PropertyClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class TransferClient implements TransferApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<TransferResponse> initiateTransfer(Long actorId, ActorRole actorRole,
                                                             InitiateTransferRequest request) {
        log.debug("Calling initiateTransfer: propertyId={}, newOwnerId={}, type={}",
                request.propertyId(), request.newOwnerId(), request.transferType());

        return webClient.post()
                .uri("/api/v1/transfers")
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> getTransfer(Long actorId, ActorRole actorRole, UUID transferId) {
        log.debug("Calling getTransfer: transferId={}", transferId);

        return webClient.get()
                .uri("/api/v1/transfers/{transferId}", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<TransferResponse>> listTransfers(Long actorId, ActorRole actorRole,
                                                                         TransferStatus status, int page, int size) {
        log.debug("Calling listTransfers: status={}, page={}, size={}", status, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/transfers")
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<TransferResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<TransferResponse>> listMyTransfers(Long actorId, ActorRole actorRole,
                                                                           int page, int size) {
        log.debug("Calling listMyTransfers: actorId={}, page={}, size={}", actorId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/transfers/mine")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<TransferResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<TransferResponse>> listPropertyTransfers(Long actorId, ActorRole actorRole,
                                                                        UUID propertyId) {
        log.debug("Calling listPropertyTransfers: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/transfers/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<TransferResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> submitTransferDocuments(Long actorId, ActorRole actorRole,
                                                                    UUID transferId,
                                                                    SubmitTransferDocumentsRequest request) {
        log.debug("Calling submitTransferDocuments: transferId={}, count={}",
                transferId, request.documents().size());

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/documents", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> reviewDocuments(Long actorId, ActorRole actorRole, UUID transferId,
                                                            ReviewTransferDocumentsRequest request) {
        log.debug("Calling reviewDocuments: transferId={}, decisions={}",
                transferId, request.decisions().size());

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/documents/review", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> performComplianceChecks(Long actorId, ActorRole actorRole,
                                                                    UUID transferId,
                                                                    ComplianceCheckRequest request) {
        log.debug("Calling performComplianceChecks: transferId={}", transferId);

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/compliance", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> approveTransfer(Long actorId, ActorRole actorRole, UUID transferId,
                                                            NotesRequest request) {
        log.debug("Calling approveTransfer: transferId={}", transferId);

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/approve", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> rejectTransfer(Long actorId, ActorRole actorRole, UUID transferId,
                                                           ReasonRequest request) {
        log.debug("Calling rejectTransfer: transferId={}", transferId);

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/reject", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> cancelTransfer(Long actorId, ActorRole actorRole, UUID transferId,
                                                           ReasonRequest request) {
        log.debug("Calling cancelTransfer: transferId={}", transferId);

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/cancel", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> completeTransfer(Long actorId, ActorRole actorRole, UUID transferId) {
        log.debug("Calling completeTransfer: transferId={}", transferId);

        return webClient.post()
                .uri("/api/v1/transfers/{transferId}/complete", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }
}
