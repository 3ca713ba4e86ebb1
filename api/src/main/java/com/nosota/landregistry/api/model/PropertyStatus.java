package com.nosota.landregistry.api.model;

/**
 * Composite status of a property registration application.
 *
 * <p>Only APPROVED and REJECTED are set by an explicit officer decision. All other values are
 * derived from the application's documentsValidated and paymentCompleted flags.
 */
public enum PropertyStatus {
    /**
     * PENDING: Application submitted, no officer has looked at it yet.
     */
    PENDING,

    /**
     * UNDER_REVIEW: An officer has started reviewing documents or payments.
     */
    UNDER_REVIEW,

    /**
     * DOCUMENTS_VALIDATED: Every required document is verified, registration fee not yet verified.
     */
    DOCUMENTS_VALIDATED,

    /**
     * PAYMENT_COMPLETED: Documents validated and registration fee verified. Ready for approval.
     */
    PAYMENT_COMPLETED,

    /**
     * APPROVED: Registration approved by a land officer or admin.
     * This is a final state.
     */
    APPROVED,

    /**
     * REJECTED: Registration rejected with a reason.
     * This is a final state.
     */
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }
}
