package com.nosota.landregistry.event;

import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.config.CorrelationIdFilter;
import com.nosota.landregistry.security.Actor;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Builds and publishes {@link WorkflowTransitionEvent}s for the workflow services.
 */
@Component
@RequiredArgsConstructor
public class WorkflowEventPublisher {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void publish(AuditEntityType entityType, UUID entityId, UUID propertyId, String action,
                        Enum<?> fromStatus, Enum<?> toStatus, Actor actor, String notes) {
        eventPublisher.publishEvent(new WorkflowTransitionEvent(
                entityType,
                entityId,
                propertyId,
                action,
                fromStatus != null ? fromStatus.name() : null,
                toStatus != null ? toStatus.name() : null,
                actor != null ? actor.id() : null,
                actor != null ? actor.role() : null,
                notes,
                LocalDateTime.now(clock),
                MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)
        ));
    }

    /**
     * Transition derived by the system (flag recomputation), not attributed to a caller.
     */
    public void publishDerived(AuditEntityType entityType, UUID entityId, UUID propertyId, String action,
                               Enum<?> fromStatus, Enum<?> toStatus, String notes) {
        publish(entityType, entityId, propertyId, action, fromStatus, toStatus, null, notes);
    }
}
