package com.nosota.landregistry.scheduler;

import com.nosota.landregistry.service.PropertyApplicationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Periodically recomputes the derived flags of every open property application and corrects
 * stored values that drifted from the documents and payments they summarize.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   reconciliation:
 *     enabled: true
 *     cron: "0 0/15 * * * *"    # every 15 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AggregateReconciliationScheduler {

    private final PropertyApplicationService propertyApplicationService;

    @Scheduled(cron = "${scheduler.reconciliation.cron:0 0/15 * * * *}")
    public void reconcileOpenApplications() {
        log.info("Starting scheduled job: reconcile open property applications");

        List<UUID> ids;
        try {
            ids = propertyApplicationService.openApplicationIds();
        } catch (Exception e) {
            log.error("Failed to load open property applications: {}", e.getMessage(), e);
            return;
        }

        int corrected = 0;
        int failed = 0;
        for (UUID id : ids) {
            try {
                if (propertyApplicationService.reconcileApplication(id)) {
                    corrected++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to reconcile property application {}: {}", id, e.getMessage(), e);
            }
        }

        if (corrected > 0 || failed > 0) {
            log.info("Reconciled {} open applications: {} corrected, {} failed", ids.size(), corrected, failed);
        } else {
            log.debug("Reconciled {} open applications, no drift found", ids.size());
        }
    }
}
