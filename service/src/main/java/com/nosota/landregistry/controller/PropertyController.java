package com.nosota.landregistry.controller;

import com.nosota.landregistry.api.PropertyApi;
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
import com.nosota.landregistry.dto.PropertyMapper;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.PropertyApplicationService;
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
 * REST controller for property registration applications.
 *
 * <p>Implements {@link PropertyApi}. Submission is open to every actor; review, approval and
 * rejection are staff operations and are refused to the application's own owner.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PropertyController implements PropertyApi {

    private final PropertyApplicationService propertyApplicationService;

    @Override
    public ResponseEntity<PropertyResponse> submitProperty(Long actorId, ActorRole actorRole,
                                                           SubmitPropertyRequest request) {
        log.info("Submitting property application: plotNumber={}, type={}, actor={}",
                request.plotNumber(), request.propertyType(), actorId);

        PropertyApplication application = propertyApplicationService.submit(Actor.of(actorId, actorRole), request);

        return ResponseEntity.status(HttpStatus.CREATED).body(PropertyMapper.INSTANCE.toResponse(application));
    }

    @Override
    public ResponseEntity<PropertyResponse> updateProperty(Long actorId, ActorRole actorRole, UUID propertyId,
                                                           UpdatePropertyRequest request) {
        log.info("Updating property application {}: area={}, type={}, actor={}",
                propertyId, request.area(), request.propertyType(), actorId);
        PropertyApplication application =
                propertyApplicationService.update(Actor.of(actorId, actorRole), propertyId, request);
        return ResponseEntity.ok(PropertyMapper.INSTANCE.toResponse(application));
    }

    @Override
    public ResponseEntity<PropertyResponse> getProperty(Long actorId, ActorRole actorRole, UUID propertyId) {
        PropertyApplication application = propertyApplicationService.getProperty(Actor.of(actorId, actorRole), propertyId);
        return ResponseEntity.ok(PropertyMapper.INSTANCE.toResponse(application));
    }

    @Override
    public ResponseEntity<PagedResponse<PropertyResponse>> listMyProperties(Long actorId, ActorRole actorRole,
                                                                            int page, int size) {
        Page<PropertyApplication> applications =
                propertyApplicationService.listMyProperties(Actor.of(actorId, actorRole), page, size);
        return ResponseEntity.ok(toPagedResponse(applications));
    }

    @Override
    public ResponseEntity<PagedResponse<PropertyResponse>> listProperties(Long actorId, ActorRole actorRole,
                                                                          PropertyStatus status, int page, int size) {
        Page<PropertyApplication> applications =
                propertyApplicationService.listProperties(Actor.of(actorId, actorRole), status, page, size);
        return ResponseEntity.ok(toPagedResponse(applications));
    }

    @Override
    public ResponseEntity<WorkflowStatusResponse> getWorkflowStatus(Long actorId, ActorRole actorRole,
                                                                    UUID propertyId) {
        return ResponseEntity.ok(propertyApplicationService.getWorkflowStatus(Actor.of(actorId, actorRole), propertyId));
    }

    @Override
    public ResponseEntity<List<OwnershipRecordResponse>> getOwnershipHistory(Long actorId, ActorRole actorRole,
                                                                             UUID propertyId) {
        return ResponseEntity.ok(PropertyMapper.INSTANCE.toOwnershipResponseList(
                propertyApplicationService.getOwnershipHistory(Actor.of(actorId, actorRole), propertyId)));
    }

    @Override
    public ResponseEntity<PropertyResponse> startReview(Long actorId, ActorRole actorRole, UUID propertyId) {
        log.info("Starting review of application {} by {}", propertyId, actorId);
        PropertyApplication application = propertyApplicationService.startReview(Actor.of(actorId, actorRole), propertyId);
        return ResponseEntity.ok(PropertyMapper.INSTANCE.toResponse(application));
    }

    @Override
    public ResponseEntity<PropertyResponse> approve(Long actorId, ActorRole actorRole, UUID propertyId,
                                                    NotesRequest request) {
        log.info("Approving application {} by {}", propertyId, actorId);
        PropertyApplication application =
                propertyApplicationService.approve(Actor.of(actorId, actorRole), propertyId, request.notes());
        return ResponseEntity.ok(PropertyMapper.INSTANCE.toResponse(application));
    }

    @Override
    public ResponseEntity<PropertyResponse> reject(Long actorId, ActorRole actorRole, UUID propertyId,
                                                   ReasonRequest request) {
        log.info("Rejecting application {} by {}", propertyId, actorId);
        PropertyApplication application =
                propertyApplicationService.reject(Actor.of(actorId, actorRole), propertyId, request.reason());
        return ResponseEntity.ok(PropertyMapper.INSTANCE.toResponse(application));
    }

    private static PagedResponse<PropertyResponse> toPagedResponse(Page<PropertyApplication> page) {
        return new PagedResponse<>(
                PropertyMapper.INSTANCE.toResponseList(page.getContent()),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
