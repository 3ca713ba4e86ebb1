package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.PaymentStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Outcome reported by the payment rail.
 *
 * @param status        COMPLETED or FAILED
 * @param transactionId Rail transaction id, unique across payments
 */
public record PaymentStatusUpdateRequest(
        @NotNull(message = "Status is required")
        PaymentStatus status,

        String transactionId
) {
}
