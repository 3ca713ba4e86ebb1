package com.nosota.landregistry.event;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published inside the transaction of every workflow transition.
 *
 * <p>Listeners run after commit, so a rolled back transition never produces an audit entry or a notification.
 *
 * @param entityType    Kind of entity that transitioned
 * @param entityId      Entity id
 * @param propertyId    Property the entity belongs to
 * @param action        Transition name, e.g. DOCUMENT_VERIFIED
 * @param fromStatus    Status before the transition, null on creation
 * @param toStatus      Status after the transition
 * @param actorId       Caller, null for derived transitions
 * @param actorRole     Caller role, null for derived transitions
 * @param notes         Notes or reason given with the transition
 * @param occurredAt    Transition time
 * @param correlationId Request correlation id, carried to async listeners
 */
public record WorkflowTransitionEvent(
        AuditEntityType entityType,
        UUID entityId,
        UUID propertyId,
        String action,
        String fromStatus,
        String toStatus,
        Long actorId,
        ActorRole actorRole,
        String notes,
        LocalDateTime occurredAt,
        String correlationId
) {
}
