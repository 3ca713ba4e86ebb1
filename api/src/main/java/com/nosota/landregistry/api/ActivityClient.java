package com.nosota.landregistry.api;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.response.AuditEntryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

@RequiredArgsConstructor
@Slf4j
public class ActivityClient implements ActivityApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<AuditEntryResponse>> getPropertyActivity(Long actorId, ActorRole actorRole,
                                                                        UUID propertyId) {
        log.debug("Calling getPropertyActivity: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/activity/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<AuditEntryResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<AuditEntryResponse>> getEntityActivity(Long actorId, ActorRole actorRole,
                                                                      AuditEntityType entityType, UUID entityId) {
        log.debug("Calling getEntityActivity: entityType={}, entityId={}", entityType, entityId);

        return webClient.get()
                .uri("/api/v1/activity/{entityType}/{entityId}", entityType, entityId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<AuditEntryResponse>>() {})
                .block();
    }
}
