package com.nosota.landregistry.api.model;

/**
 * Payment rails accepted by the registry.
 */
public enum PaymentMethod {
    CBE_BIRR,
    TELEBIRR,
    AMOLE,
    BANK_TRANSFER,
    CASH
}
