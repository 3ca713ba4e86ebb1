package com.nosota.landregistry.api.model;

/**
 * Officer review of a completed payment.
 */
public enum PaymentVerificationStatus {
    UNSET,
    VERIFIED,
    REJECTED
}
