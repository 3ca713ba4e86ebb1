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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
@Slf4j
public class DisputeClient implements DisputeApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<DisputeResponse> fileDispute(Long actorId, ActorRole actorRole,
                                                       FileDisputeRequest request) {
        log.debug("Calling fileDispute: propertyId={}, type={}", request.propertyId(), request.disputeType());

        return webClient.post()
                .uri("/api/v1/disputes")
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> getDispute(Long actorId, ActorRole actorRole, UUID disputeId) {
        log.debug("Calling getDispute: disputeId={}", disputeId);

        return webClient.get()
                .uri("/api/v1/disputes/{disputeId}", disputeId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<DisputeResponse>> listDisputes(Long actorId, ActorRole actorRole,
                                                                       DisputeStatus status, int page, int size) {
        log.debug("Calling listDisputes: status={}, page={}, size={}", status, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/disputes")
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<DisputeResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<DisputeResponse>> listMyDisputes(Long actorId, ActorRole actorRole,
                                                                         int page, int size) {
        log.debug("Calling listMyDisputes: actorId={}, page={}, size={}", actorId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/disputes/mine")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<DisputeResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> updateStatus(Long actorId, ActorRole actorRole, UUID disputeId,
                                                        DisputeStatusUpdateRequest request) {
        log.debug("Calling updateStatus: disputeId={}, status={}", disputeId, request.status());

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/status", disputeId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> assignDispute(Long actorId, ActorRole actorRole, UUID disputeId,
                                                         AssignDisputeRequest request) {
        log.debug("Calling assignDispute: disputeId={}, officerId={}", disputeId, request.officerId());

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/assign", disputeId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> resolveDispute(Long actorId, ActorRole actorRole, UUID disputeId,
                                                          ResolveDisputeRequest request) {
        log.debug("Calling resolveDispute: disputeId={}, decision={}", disputeId, request.decision());

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/resolve", disputeId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> withdrawDispute(Long actorId, ActorRole actorRole, UUID disputeId,
                                                           ReasonRequest request) {
        log.debug("Calling withdrawDispute: disputeId={}", disputeId);

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/withdraw", disputeId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }
}
