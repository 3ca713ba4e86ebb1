package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.PaymentMethod;
import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for a payment.
 *
 * <p>Exactly one of {@code propertyId} and {@code transferId} is set.
 *
 * @param id                   Payment UUID
 * @param propertyId           Property application scope
 * @param transferId           Transfer scope
 * @param payerId              Actor who initiated the payment
 * @param amount               Amount in ETB, exact decimal
 * @param currency             ISO 4217 code
 * @param paymentType          Fee being paid
 * @param paymentMethod        Rail used
 * @param paymentMethodDetails Rail-specific details
 * @param transactionId        Rail transaction id
 * @param status               Rail status (PENDING, COMPLETED, FAILED)
 * @param verificationStatus   Officer verification (UNSET, VERIFIED, REJECTED)
 * @param receiptNumber        Receipt issued on completion
 * @param notes                Officer notes
 * @param verifiedBy           Officer who verified or rejected
 * @param verifiedAt           Verification timestamp
 * @param completedAt          When the rail reported completion
 * @param createdAt            Creation timestamp
 * @param updatedAt            Last update timestamp
 */
public record PaymentResponse(
        UUID id,
        UUID propertyId,
        UUID transferId,
        Long payerId,
        BigDecimal amount,
        String currency,
        PaymentType paymentType,
        PaymentMethod paymentMethod,
        Map<String, String> paymentMethodDetails,
        String transactionId,
        PaymentStatus status,
        PaymentVerificationStatus verificationStatus,
        String receiptNumber,
        String notes,
        Long verifiedBy,
        LocalDateTime verifiedAt,
        LocalDateTime completedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
