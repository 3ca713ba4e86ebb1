package com.nosota.landregistry.event;

import com.nosota.landregistry.model.AuditEntry;
import com.nosota.landregistry.repository.AuditEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes one audit entry per committed workflow transition.
 *
 * <p>Audit writes are best-effort: the entry is saved in its own transaction after the transition
 * committed. A failed write is logged at ERROR and counted, and never reaches the caller.
 */
@Component
@Slf4j
public class AuditTrailListener {

    private final AuditEntryRepository auditEntryRepository;
    private final TransactionTemplate requiresNew;
    private final AtomicLong failedWrites = new AtomicLong();

    public AuditTrailListener(AuditEntryRepository auditEntryRepository,
                              PlatformTransactionManager transactionManager) {
        this.auditEntryRepository = auditEntryRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTransition(WorkflowTransitionEvent event) {
        AuditEntry entry = AuditEntry.builder()
                .entityType(event.entityType())
                .entityId(event.entityId())
                .propertyId(event.propertyId())
                .action(event.action())
                .fromStatus(event.fromStatus())
                .toStatus(event.toStatus())
                .actorId(event.actorId())
                .actorRole(event.actorRole())
                .notes(event.notes())
                .occurredAt(event.occurredAt())
                .build();

        try {
            requiresNew.executeWithoutResult(status -> auditEntryRepository.save(entry));
            log.debug("Audit entry written: {} {} {} → {}",
                    event.action(), event.entityId(), event.fromStatus(), event.toStatus());
        } catch (RuntimeException e) {
            long failures = failedWrites.incrementAndGet();
            log.error("Failed to write audit entry [correlationId={}, action={}, entityType={}, entityId={}, " +
                            "totalFailures={}]: {}",
                    event.correlationId(), event.action(), event.entityType(), event.entityId(),
                    failures, e.getMessage(), e);
        }
    }

    /**
     * Number of audit writes that failed since startup.
     */
    public long getFailedWrites() {
        return failedWrites.get();
    }
}
