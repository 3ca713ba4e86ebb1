package com.nosota.landregistry.dto;

import java.util.UUID;

/**
 * Aggregate a payment belongs to. Exactly one of the two ids is set.
 */
public record PaymentScope(UUID propertyId, UUID transferId) {

    public boolean isTransferScoped() {
        return transferId != null;
    }
}
