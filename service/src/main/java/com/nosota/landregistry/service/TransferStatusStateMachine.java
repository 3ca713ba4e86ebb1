package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table of the transfer workflow. Every legal edge lives here.
 *
 * <p>State diagram:
 * <pre>
 * INITIATED → DOCUMENTS_PENDING → DOCUMENTS_SUBMITTED → UNDER_REVIEW → COMPLIANCE_CHECK → APPROVED → COMPLETED
 *     |               ^                  |
 *     +---------------|------------------+  (documents submitted before the fee is paid)
 *                     +------------------+  (a reviewed document was rejected)
 *
 * REJECTED, CANCELLED: from every state before COMPLETED
 * </pre>
 */
@Component
public class TransferStatusStateMachine {

    private static final Set<TransferStatus> ABORT_TARGETS = EnumSet.of(
            TransferStatus.REJECTED,
            TransferStatus.CANCELLED
    );

    private static final Map<TransferStatus, Set<TransferStatus>> ALLOWED_TRANSITIONS = new EnumMap<>(Map.of(
            TransferStatus.INITIATED, EnumSet.of(
                    TransferStatus.DOCUMENTS_PENDING,
                    TransferStatus.DOCUMENTS_SUBMITTED),
            TransferStatus.DOCUMENTS_PENDING, EnumSet.of(
                    TransferStatus.DOCUMENTS_SUBMITTED),
            TransferStatus.DOCUMENTS_SUBMITTED, EnumSet.of(
                    TransferStatus.DOCUMENTS_PENDING,
                    TransferStatus.UNDER_REVIEW),
            TransferStatus.UNDER_REVIEW, EnumSet.of(
                    TransferStatus.COMPLIANCE_CHECK),
            TransferStatus.COMPLIANCE_CHECK, EnumSet.of(
                    TransferStatus.APPROVED),
            TransferStatus.APPROVED, EnumSet.of(
                    TransferStatus.COMPLETED)
    ));

    public boolean isTransitionAllowed(TransferStatus fromStatus, TransferStatus toStatus) {
        if (fromStatus == null || toStatus == null || fromStatus == toStatus || isFinalState(fromStatus)) {
            return false;
        }
        if (ABORT_TARGETS.contains(toStatus)) {
            return true;
        }
        return getAllowedTransitions(fromStatus).contains(toStatus);
    }

    /**
     * Validates a transition.
     *
     * @throws ConflictException     if the transfer is already in a final state
     * @throws InvalidStateException if the edge is not in the table
     */
    public void validateTransition(TransferStatus fromStatus, TransferStatus toStatus) {
        if (isFinalState(fromStatus)) {
            throw new ConflictException(
                    String.format("Transfer is already %s, no further transitions are allowed", fromStatus));
        }
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(
                    String.format("Invalid transfer status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus, getAllowedTransitions(fromStatus)));
        }
    }

    public boolean isFinalState(TransferStatus status) {
        return status != null && status.isTerminal();
    }

    /**
     * Forward targets of a status, without the REJECTED and CANCELLED exits.
     */
    public Set<TransferStatus> getAllowedTransitions(TransferStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
