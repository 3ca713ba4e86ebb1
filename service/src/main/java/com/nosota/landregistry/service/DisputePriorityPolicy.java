package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.DisputePriority;
import com.nosota.landregistry.api.model.DisputeType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Priority of a dispute, computed on every read and never stored.
 *
 * <p>HIGH for fraudulent registration and ownership disputes, or anything older than 30 days.
 * MEDIUM past 14 days. LOW otherwise.
 */
@Component
public class DisputePriorityPolicy {

    static final Duration HIGH_AFTER = Duration.ofDays(30);
    static final Duration MEDIUM_AFTER = Duration.ofDays(14);

    public DisputePriority priorityOf(DisputeType disputeType, LocalDateTime createdAt, LocalDateTime now) {
        if (disputeType == DisputeType.FRAUDULENT_REGISTRATION || disputeType == DisputeType.OWNERSHIP_DISPUTE) {
            return DisputePriority.HIGH;
        }
        Duration age = Duration.between(createdAt, now);
        if (age.compareTo(HIGH_AFTER) > 0) {
            return DisputePriority.HIGH;
        }
        if (age.compareTo(MEDIUM_AFTER) > 0) {
            return DisputePriority.MEDIUM;
        }
        return DisputePriority.LOW;
    }
}
