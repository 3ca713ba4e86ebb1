package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table of a property application document.
 *
 * <p>State diagram:
 * <pre>
 * PENDING → VERIFIED | REJECTED | NEEDS_UPDATE
 * NEEDS_UPDATE → VERIFIED | REJECTED | PENDING (replaced)
 * REJECTED → PENDING (replaced) | VERIFIED (re-verification)
 * VERIFIED → REJECTED (re-verification)
 * </pre>
 *
 * <p>Leaving VERIFIED or REJECTED through an officer decision requires an explicit re-verification request.
 */
@Component
public class DocumentStatusStateMachine {

    private static final Map<DocumentStatus, Set<DocumentStatus>> ALLOWED_TRANSITIONS = new EnumMap<>(Map.of(
            DocumentStatus.PENDING, EnumSet.of(
                    DocumentStatus.VERIFIED,
                    DocumentStatus.REJECTED,
                    DocumentStatus.NEEDS_UPDATE),
            DocumentStatus.NEEDS_UPDATE, EnumSet.of(
                    DocumentStatus.VERIFIED,
                    DocumentStatus.REJECTED,
                    DocumentStatus.PENDING),
            DocumentStatus.REJECTED, EnumSet.of(
                    DocumentStatus.PENDING,
                    DocumentStatus.VERIFIED),
            DocumentStatus.VERIFIED, EnumSet.of(
                    DocumentStatus.REJECTED)
    ));

    private static final Set<DocumentStatus> REPLACEABLE = EnumSet.of(
            DocumentStatus.PENDING,
            DocumentStatus.NEEDS_UPDATE,
            DocumentStatus.REJECTED
    );

    public boolean isTransitionAllowed(DocumentStatus fromStatus, DocumentStatus toStatus) {
        Set<DocumentStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates an officer decision.
     *
     * @param reverify whether the caller explicitly asked to change a decided document
     * @throws ConflictException     if the document already has the target status, or is decided
     *                               and {@code reverify} is not set
     * @throws InvalidStateException if the edge is not in the table
     */
    public void validateDecision(DocumentStatus fromStatus, DocumentStatus toStatus, boolean reverify) {
        if (fromStatus == toStatus) {
            throw new ConflictException("Document is already " + fromStatus);
        }
        if (fromStatus.isDecided() && !reverify) {
            throw new ConflictException(String.format(
                    "Document is already %s; request re-verification to change the decision", fromStatus));
        }
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(
                    String.format("Invalid document status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus, ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    /**
     * @throws InvalidStateException if the file of a document in this status cannot be replaced
     */
    public void validateReplacement(DocumentStatus status) {
        if (!REPLACEABLE.contains(status)) {
            throw new InvalidStateException(String.format(
                    "Document in status %s cannot be replaced. Replaceable statuses: %s", status, REPLACEABLE));
        }
    }
}
