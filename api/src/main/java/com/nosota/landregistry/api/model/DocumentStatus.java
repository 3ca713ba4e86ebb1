package com.nosota.landregistry.api.model;

/**
 * Review state of a document attached to a property application.
 */
public enum DocumentStatus {
    /**
     * PENDING: Uploaded (or replaced) and waiting for an officer.
     */
    PENDING,

    /**
     * VERIFIED: Accepted by an officer. Changes only through explicit re-verification.
     */
    VERIFIED,

    /**
     * REJECTED: Refused by an officer. Blocks document validation of the application
     * until the document is replaced and verified again.
     */
    REJECTED,

    /**
     * NEEDS_UPDATE: Officer asked the owner for a corrected file.
     */
    NEEDS_UPDATE;

    public boolean isDecided() {
        return this == VERIFIED || this == REJECTED;
    }
}
