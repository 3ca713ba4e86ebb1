package com.nosota.landregistry.event;

/**
 * Receives one event per committed transition. Delivery (email, SMS, push) is external.
 *
 * <p>Implementations may throw; the dispatcher retries a bounded number of times.
 */
public interface NotificationSink {

    void deliver(WorkflowTransitionEvent event);
}
