package com.nosota.landregistry.api;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.response.AuditEntryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;
import java.util.UUID;

/**
 * Read-only access to the append-only activity log.
 */
@RequestMapping("/api/v1/activity")
public interface ActivityApi {

    /**
     * Every transition touching a property, its documents, payments, transfers and disputes,
     * oldest first. Owner or staff.
     */
    @GetMapping("/properties/{propertyId}")
    ResponseEntity<List<AuditEntryResponse>> getPropertyActivity(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    @GetMapping("/{entityType}/{entityId}")
    ResponseEntity<List<AuditEntryResponse>> getEntityActivity(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("entityType") AuditEntityType entityType,
            @PathVariable("entityId") UUID entityId);
}
