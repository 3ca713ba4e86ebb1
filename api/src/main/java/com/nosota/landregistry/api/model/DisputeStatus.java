package com.nosota.landregistry.api.model;

/**
 * Lifecycle of a dispute raised against a property.
 *
 * <pre>
 * SUBMITTED → UNDER_REVIEW → {INVESTIGATION | MEDIATION} → RESOLVED | DISMISSED
 *
 * WITHDRAWN: by the disputant, any time before a final state
 * </pre>
 */
public enum DisputeStatus {
    SUBMITTED,
    UNDER_REVIEW,
    INVESTIGATION,
    MEDIATION,
    RESOLVED,
    DISMISSED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED || this == WITHDRAWN;
    }
}
