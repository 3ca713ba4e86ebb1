package com.nosota.landregistry.dto;

/**
 * Result of projecting an application's documents and payments onto its two derived flags.
 */
public record AggregateFlags(boolean documentsValidated, boolean paymentCompleted) {

    public boolean readyForApproval() {
        return documentsValidated && paymentCompleted;
    }
}
