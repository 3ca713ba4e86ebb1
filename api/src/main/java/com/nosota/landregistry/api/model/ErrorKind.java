package com.nosota.landregistry.api.model;

/**
 * Failure taxonomy surfaced to callers of workflow operations.
 */
public enum ErrorKind {
    /**
     * Unknown entity id.
     */
    NOT_FOUND,

    /**
     * Role or ownership guard failed.
     */
    FORBIDDEN,

    /**
     * Missing or malformed required field.
     */
    VALIDATION_ERROR,

    /**
     * Payment amount is zero or negative.
     */
    INVALID_AMOUNT,

    /**
     * Duplicate plot number or repeated transition of a final entity.
     */
    CONFLICT,

    /**
     * Operation attempted before its business preconditions hold.
     */
    PRECONDITION_FAILED,

    /**
     * Transition is not legal from the current state.
     */
    INVALID_STATE,

    /**
     * Unexpected server-side failure.
     */
    INTERNAL
}
