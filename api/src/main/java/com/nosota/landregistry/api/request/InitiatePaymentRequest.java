package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.PaymentMethod;
import com.nosota.landregistry.api.model.PaymentType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for initiating a payment.
 *
 * <p>Exactly one of {@code propertyId} and {@code transferId} must be set. TRANSFER_FEE
 * payments are transfer-scoped, every other type is property-scoped.
 *
 * @param propertyId           Property application being paid for
 * @param transferId           Transfer being paid for
 * @param amount               Amount in ETB, exact decimal
 * @param currency             ISO 4217 code, ETB when omitted
 * @param paymentType          Fee being paid
 * @param paymentMethod        Rail used
 * @param paymentMethodDetails Rail-specific details (account number, phone number, reference)
 */
public record InitiatePaymentRequest(
        UUID propertyId,

        UUID transferId,

        @NotNull(message = "Amount is required")
        BigDecimal amount,

        @Size(min = 3, max = 3, message = "Currency must be a 3-letter ISO code")
        String currency,

        @NotNull(message = "Payment type is required")
        PaymentType paymentType,

        @NotNull(message = "Payment method is required")
        PaymentMethod paymentMethod,

        Map<String, String> paymentMethodDetails
) {
}
