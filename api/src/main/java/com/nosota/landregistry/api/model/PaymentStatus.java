package com.nosota.landregistry.api.model;

/**
 * Outcome reported by the external payment rail.
 */
public enum PaymentStatus {
    /**
     * PENDING: Payment initiated, rail has not reported back.
     */
    PENDING,

    /**
     * COMPLETED: Rail confirmed the funds. Only completed payments can be verified.
     */
    COMPLETED,

    /**
     * FAILED: Rail reported a failure. Final.
     */
    FAILED
}
