package com.nosota.landregistry.controller;

import com.nosota.landregistry.api.ActivityApi;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.response.AuditEntryResponse;
import com.nosota.landregistry.dto.AuditEntryMapper;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.AuditTrailService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
public class ActivityController implements ActivityApi {

    private final AuditTrailService auditTrailService;

    @Override
    public ResponseEntity<List<AuditEntryResponse>> getPropertyActivity(Long actorId, ActorRole actorRole,
                                                                        UUID propertyId) {
        return ResponseEntity.ok(AuditEntryMapper.INSTANCE.toResponseList(
                auditTrailService.getPropertyActivity(Actor.of(actorId, actorRole), propertyId)));
    }

    @Override
    public ResponseEntity<List<AuditEntryResponse>> getEntityActivity(Long actorId, ActorRole actorRole,
                                                                      AuditEntityType entityType, UUID entityId) {
        return ResponseEntity.ok(AuditEntryMapper.INSTANCE.toResponseList(
                auditTrailService.getEntityActivity(Actor.of(actorId, actorRole), entityType, entityId)));
    }
}
