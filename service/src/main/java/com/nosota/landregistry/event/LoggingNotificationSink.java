package com.nosota.landregistry.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * Default sink: one structured log line per transition.
 */
@Component
@ConditionalOnMissingBean(value = NotificationSink.class, ignored = LoggingNotificationSink.class)
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void deliver(WorkflowTransitionEvent event) {
        log.info("notification entityType={} entityId={} propertyId={} action={} from={} to={} actorId={} " +
                        "actorRole={} at={} correlationId={}",
                event.entityType(), event.entityId(), event.propertyId(), event.action(),
                event.fromStatus(), event.toStatus(), event.actorId(), event.actorRole(),
                event.occurredAt(), event.correlationId());
    }
}
