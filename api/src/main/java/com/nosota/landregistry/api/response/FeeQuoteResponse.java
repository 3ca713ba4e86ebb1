package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.PaymentType;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Fee the payer is expected to pay. {@code verifyPayment} compares against {@code amount} exactly.
 *
 * @param paymentType Fee type
 * @param scopeId     Property or transfer the fee applies to
 * @param amount      Total fee
 * @param currency    ISO 4217 code
 * @param breakdown   Named components adding up to {@code amount}
 */
public record FeeQuoteResponse(
        PaymentType paymentType,
        UUID scopeId,
        BigDecimal amount,
        String currency,
        Map<String, BigDecimal> breakdown
) {
}
