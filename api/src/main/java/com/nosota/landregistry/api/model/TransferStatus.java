package com.nosota.landregistry.api.model;

/**
 * Lifecycle of an ownership transfer.
 *
 * <pre>
 * INITIATED → DOCUMENTS_PENDING → DOCUMENTS_SUBMITTED → UNDER_REVIEW → COMPLIANCE_CHECK → APPROVED → COMPLETED
 *
 * REJECTED / CANCELLED: reachable from every state before COMPLETED
 * </pre>
 */
public enum TransferStatus {
    INITIATED,
    DOCUMENTS_PENDING,
    DOCUMENTS_SUBMITTED,
    UNDER_REVIEW,
    COMPLIANCE_CHECK,
    APPROVED,
    REJECTED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == CANCELLED;
    }
}
