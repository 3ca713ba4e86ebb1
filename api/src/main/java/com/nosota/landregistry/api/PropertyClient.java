package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.SubmitPropertyRequest;
import com.nosota.landregistry.api.request.UpdatePropertyRequest;
import com.nosota.landregistry.api.response.OwnershipRecordResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import com.nosota.landregistry.api.response.WorkflowStatusResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * WebClient-based implementation of PropertyApi for consuming the registry service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class LandRegistryClientConfig {
 *     @Bean
 *     public WebClient landRegistryWebClient(WebClient.Builder builder,
 *                                            @Value("${services.landregistry.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public PropertyClient propertyClient(WebClient landRegistryWebClient) {
 *         return new PropertyClient(landRegistryWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class PropertyClient implements PropertyApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<PropertyResponse> submitProperty(Long actorId, ActorRole actorRole,
                                                           SubmitPropertyRequest request) {
        log.debug("Calling submitProperty: actorId={}, plotNumber={}", actorId, request.plotNumber());

        return webClient.post()
                .uri("/api/v1/properties")
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PropertyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PropertyResponse> updateProperty(Long actorId, ActorRole actorRole, UUID propertyId,
                                                           UpdatePropertyRequest request) {
        log.debug("Calling updateProperty: propertyId={}", propertyId);

        return webClient.put()
                .uri("/api/v1/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PropertyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PropertyResponse> getProperty(Long actorId, ActorRole actorRole, UUID propertyId) {
        log.debug("Calling getProperty: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(PropertyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<PropertyResponse>> listMyProperties(Long actorId, ActorRole actorRole,
                                                                            int page, int size) {
        log.debug("Calling listMyProperties: actorId={}, page={}, size={}", actorId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/properties/mine")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<PropertyResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<PropertyResponse>> listProperties(Long actorId, ActorRole actorRole,
                                                                          PropertyStatus status, int page, int size) {
        log.debug("Calling listProperties: status={}, page={}, size={}", status, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/properties")
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<PropertyResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<WorkflowStatusResponse> getWorkflowStatus(Long actorId, ActorRole actorRole,
                                                                    UUID propertyId) {
        log.debug("Calling getWorkflowStatus: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/properties/{propertyId}/workflow", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(WorkflowStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<OwnershipRecordResponse>> getOwnershipHistory(Long actorId, ActorRole actorRole,
                                                                             UUID propertyId) {
        log.debug("Calling getOwnershipHistory: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/properties/{propertyId}/ownership-history", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<OwnershipRecordResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PropertyResponse> startReview(Long actorId, ActorRole actorRole, UUID propertyId) {
        log.debug("Calling startReview: propertyId={}", propertyId);

        return webClient.post()
                .uri("/api/v1/properties/{propertyId}/review", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(PropertyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PropertyResponse> approve(Long actorId, ActorRole actorRole, UUID propertyId,
                                                    NotesRequest request) {
        log.debug("Calling approve: propertyId={}, actorId={}", propertyId, actorId);

        return webClient.post()
                .uri("/api/v1/properties/{propertyId}/approve", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PropertyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PropertyResponse> reject(Long actorId, ActorRole actorRole, UUID propertyId,
                                                   ReasonRequest request) {
        log.debug("Calling reject: propertyId={}, actorId={}", propertyId, actorId);

        return webClient.post()
                .uri("/api/v1/properties/{propertyId}/reject", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PropertyResponse.class)
                .block();
    }
}
