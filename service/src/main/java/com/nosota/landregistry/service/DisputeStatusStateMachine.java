package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table of the dispute workflow.
 *
 * <p>State diagram:
 * <pre>
 * SUBMITTED → UNDER_REVIEW → INVESTIGATION ⇄ MEDIATION
 *     |             |              |             |
 *     +-------------+--------------+-------------+→ DISMISSED
 *
 * RESOLVED:  from every non-final state, through resolveDispute only
 * WITHDRAWN: from every non-final state, by the disputant only
 * </pre>
 */
@Component
public class DisputeStatusStateMachine {

    /**
     * Edges reachable through an officer status update.
     */
    private static final Map<DisputeStatus, Set<DisputeStatus>> STATUS_UPDATE_TRANSITIONS = new EnumMap<>(Map.of(
            DisputeStatus.SUBMITTED, EnumSet.of(
                    DisputeStatus.UNDER_REVIEW,
                    DisputeStatus.DISMISSED),
            DisputeStatus.UNDER_REVIEW, EnumSet.of(
                    DisputeStatus.INVESTIGATION,
                    DisputeStatus.MEDIATION,
                    DisputeStatus.DISMISSED),
            DisputeStatus.INVESTIGATION, EnumSet.of(
                    DisputeStatus.MEDIATION,
                    DisputeStatus.DISMISSED),
            DisputeStatus.MEDIATION, EnumSet.of(
                    DisputeStatus.INVESTIGATION,
                    DisputeStatus.DISMISSED)
    ));

    /**
     * Statuses counted as an active dispute on the property.
     */
    public static final Set<DisputeStatus> ACTIVE_STATUSES = EnumSet.of(
            DisputeStatus.SUBMITTED,
            DisputeStatus.UNDER_REVIEW,
            DisputeStatus.INVESTIGATION,
            DisputeStatus.MEDIATION
    );

    public boolean isStatusUpdateAllowed(DisputeStatus fromStatus, DisputeStatus toStatus) {
        return STATUS_UPDATE_TRANSITIONS.getOrDefault(fromStatus, Set.of()).contains(toStatus);
    }

    /**
     * Validates an officer status update.
     *
     * @throws ConflictException     if the dispute is final
     * @throws InvalidStateException if the edge is illegal, or targets RESOLVED or WITHDRAWN
     */
    public void validateStatusUpdate(DisputeStatus fromStatus, DisputeStatus toStatus) {
        requireNotFinal(fromStatus);
        if (toStatus == DisputeStatus.RESOLVED) {
            throw new InvalidStateException("A dispute is resolved through the resolve operation, which records the decision");
        }
        if (toStatus == DisputeStatus.WITHDRAWN) {
            throw new InvalidStateException("Only the disputant can withdraw a dispute");
        }
        if (!isStatusUpdateAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(
                    String.format("Invalid dispute status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            STATUS_UPDATE_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    /**
     * RESOLVED and WITHDRAWN are reachable from every non-final state.
     */
    public void requireNotFinal(DisputeStatus status) {
        if (isFinalState(status)) {
            throw new ConflictException(
                    String.format("Dispute is already %s, no further transitions are allowed", status));
        }
    }

    public boolean isFinalState(DisputeStatus status) {
        return status != null && status.isTerminal();
    }
}
