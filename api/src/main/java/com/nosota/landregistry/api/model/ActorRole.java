package com.nosota.landregistry.api.model;

/**
 * Role of the caller as supplied by the actor directory.
 *
 * <p>The registry treats the role as opaque and never derives it on its own.
 */
public enum ActorRole {
    /**
     * Member of the public: submits applications, uploads documents, pays fees, files disputes.
     */
    CITIZEN,

    /**
     * Land officer: verifies documents and payments, approves or rejects applications and transfers.
     */
    LAND_OFFICER,

    /**
     * Administrator: everything a land officer can do, plus dispute assignment and transfer completion.
     */
    ADMIN;

    public boolean isStaff() {
        return this == LAND_OFFICER || this == ADMIN;
    }
}
