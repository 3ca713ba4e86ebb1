package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One entry of the activity log.
 *
 * @param actorRole Null for transitions derived by the system (flag recomputation)
 */
public record AuditEntryResponse(
        UUID id,
        AuditEntityType entityType,
        UUID entityId,
        UUID propertyId,
        String action,
        String fromStatus,
        String toStatus,
        Long actorId,
        ActorRole actorRole,
        String notes,
        LocalDateTime occurredAt
) {
}
