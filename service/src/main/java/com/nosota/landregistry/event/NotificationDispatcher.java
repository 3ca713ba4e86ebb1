package com.nosota.landregistry.event;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands committed transitions to the {@link NotificationSink} off the request thread.
 *
 * <p>Delivery never blocks or fails a transition. Exhausted retries are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final NotificationSink notificationSink;
    private final Retry notificationRetry;

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTransition(WorkflowTransitionEvent event) {
        dispatch(event);
    }

    void dispatch(WorkflowTransitionEvent event) {
        try {
            Retry.decorateRunnable(notificationRetry, () -> notificationSink.deliver(event)).run();
        } catch (RuntimeException e) {
            log.error("Notification delivery failed after {} attempts [correlationId={}, action={}, entityId={}]: {}",
                    notificationRetry.getRetryConfig().getMaxAttempts(), event.correlationId(),
                    event.action(), event.entityId(), e.getMessage());
        }
    }
}
