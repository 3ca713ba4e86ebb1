package com.nosota.landregistry.controller;

import com.nosota.landregistry.api.DisputeApi;
import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.api.request.AssignDisputeRequest;
import com.nosota.landregistry.api.request.DisputeStatusUpdateRequest;
import com.nosota.landregistry.api.request.FileDisputeRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.ResolveDisputeRequest;
import com.nosota.landregistry.api.response.DisputeResponse;
import com.nosota.landregistry.dto.DisputeMapper;
import com.nosota.landregistry.model.Dispute;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.DisputeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for property disputes. Priority is computed on every response.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class DisputeController implements DisputeApi {

    private final DisputeService disputeService;

    @Override
    public ResponseEntity<DisputeResponse> fileDispute(Long actorId, ActorRole actorRole, FileDisputeRequest request) {
        log.info("Filing {} dispute on property {} by {}", request.disputeType(), request.propertyId(), actorId);

        Dispute dispute = disputeService.fileDispute(Actor.of(actorId, actorRole), request);

        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(dispute));
    }

    @Override
    public ResponseEntity<DisputeResponse> getDispute(Long actorId, ActorRole actorRole, UUID disputeId) {
        return ResponseEntity.ok(toResponse(disputeService.getDispute(Actor.of(actorId, actorRole), disputeId)));
    }

    @Override
    public ResponseEntity<PagedResponse<DisputeResponse>> listDisputes(Long actorId, ActorRole actorRole,
                                                                       DisputeStatus status, int page, int size) {
        return ResponseEntity.ok(toPagedResponse(
                disputeService.listDisputes(Actor.of(actorId, actorRole), status, page, size)));
    }

    @Override
    public ResponseEntity<PagedResponse<DisputeResponse>> listMyDisputes(Long actorId, ActorRole actorRole,
                                                                         int page, int size) {
        return ResponseEntity.ok(toPagedResponse(
                disputeService.listMyDisputes(Actor.of(actorId, actorRole), page, size)));
    }

    @Override
    public ResponseEntity<DisputeResponse> updateStatus(Long actorId, ActorRole actorRole, UUID disputeId,
                                                        DisputeStatusUpdateRequest request) {
        log.info("Updating dispute {} to {} by {}", disputeId, request.status(), actorId);
        return ResponseEntity.ok(toResponse(disputeService.updateStatus(
                Actor.of(actorId, actorRole), disputeId, request.status(), request.notes())));
    }

    @Override
    public ResponseEntity<DisputeResponse> assignDispute(Long actorId, ActorRole actorRole, UUID disputeId,
                                                         AssignDisputeRequest request) {
        log.info("Assigning dispute {} to officer {} by {}", disputeId, request.officerId(), actorId);
        return ResponseEntity.ok(toResponse(disputeService.assignDispute(
                Actor.of(actorId, actorRole), disputeId, request.officerId(), request.notes())));
    }

    @Override
    public ResponseEntity<DisputeResponse> resolveDispute(Long actorId, ActorRole actorRole, UUID disputeId,
                                                          ResolveDisputeRequest request) {
        log.info("Resolving dispute {} ({}) by {}", disputeId, request.decision(), actorId);
        return ResponseEntity.ok(toResponse(disputeService.resolveDispute(
                Actor.of(actorId, actorRole), disputeId, request)));
    }

    @Override
    public ResponseEntity<DisputeResponse> withdrawDispute(Long actorId, ActorRole actorRole, UUID disputeId,
                                                           ReasonRequest request) {
        log.info("Withdrawing dispute {} by {}", disputeId, actorId);
        return ResponseEntity.ok(toResponse(disputeService.withdrawDispute(
                Actor.of(actorId, actorRole), disputeId, request.reason())));
    }

    private DisputeResponse toResponse(Dispute dispute) {
        return DisputeMapper.INSTANCE.toResponse(dispute, disputeService.priorityOf(dispute));
    }

    private PagedResponse<DisputeResponse> toPagedResponse(Page<Dispute> page) {
        return new PagedResponse<>(
                page.getContent().stream().map(this::toResponse).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
