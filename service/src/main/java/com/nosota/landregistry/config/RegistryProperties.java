package com.nosota.landregistry.config;

import com.nosota.landregistry.api.model.DocumentType;
import com.nosota.landregistry.api.model.PropertyType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * Registry configuration bound from {@code registry.*}.
 *
 * <p>Configuration:
 * <pre>
 * registry:
 *   documents:
 *     required:
 *       RESIDENTIAL: [TITLE_DEED, ID_CARD, APPLICATION_FORM]
 *   fees:
 *     currency: ETB
 *     registration:
 *       RESIDENTIAL: { base-fee: 2500, rate-per-square-metre: 20 }
 *     transfer: { tax-rate: 0.03, stamp-duty-rate: 0.005, processing-fee: 300 }
 *   notification:
 *     max-attempts: 3
 *     initial-interval-ms: 500
 *     multiplier: 2.0
 * </pre>
 */
@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(Documents documents, Fees fees, Notification notification) {

    /**
     * @param required Document types an application of each property type must have verified
     */
    public record Documents(Map<PropertyType, Set<DocumentType>> required) {

        public Set<DocumentType> requiredFor(PropertyType propertyType) {
            Set<DocumentType> types = required.get(propertyType);
            if (types == null || types.isEmpty()) {
                throw new IllegalStateException("No required document set configured for " + propertyType);
            }
            return types;
        }
    }

    public record Fees(String currency, Map<PropertyType, RegistrationFee> registration, TransferFee transfer) {

        public RegistrationFee registrationFor(PropertyType propertyType) {
            RegistrationFee fee = registration.get(propertyType);
            if (fee == null) {
                throw new IllegalStateException("No registration fee configured for " + propertyType);
            }
            return fee;
        }
    }

    public record RegistrationFee(BigDecimal baseFee, BigDecimal ratePerSquareMetre) {
    }

    /**
     * @param taxRate       Transfer tax as a fraction of the declared value
     * @param stampDutyRate Stamp duty as a fraction of the declared value
     * @param processingFee Flat processing fee
     */
    public record TransferFee(BigDecimal taxRate, BigDecimal stampDutyRate, BigDecimal processingFee) {
    }

    public record Notification(int maxAttempts, long initialIntervalMs, double multiplier) {
    }
}
