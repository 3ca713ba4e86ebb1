package com.nosota.landregistry.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Computed fee with its components, in insertion order.
 */
public record FeeQuote(BigDecimal amount, String currency, Map<String, BigDecimal> breakdown) {
}
