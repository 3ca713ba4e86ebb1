package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.config.RegistryProperties;
import com.nosota.landregistry.dto.FeeQuote;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fee schedule of the registry.
 *
 * <p>All arithmetic is exact {@link BigDecimal}; nothing is rounded. Payment verification compares
 * the paid amount to these values with {@code compareTo}.
 *
 * <ul>
 *   <li>Registration fee = base fee of the property type + area × rate per square metre</li>
 *   <li>Transfer fee = declared value × (tax rate + stamp duty rate) + processing fee</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
public class FeeCalculationService {

    private final RegistryProperties registryProperties;

    public FeeQuote registrationFee(PropertyType propertyType, BigDecimal area) {
        RegistryProperties.RegistrationFee schedule = registryProperties.fees().registrationFor(propertyType);

        BigDecimal areaFee = area.multiply(schedule.ratePerSquareMetre());

        Map<String, BigDecimal> breakdown = new LinkedHashMap<>();
        breakdown.put("baseFee", schedule.baseFee());
        breakdown.put("areaFee", areaFee);

        return new FeeQuote(schedule.baseFee().add(areaFee), currency(), breakdown);
    }

    public FeeQuote transferFee(BigDecimal transferValue) {
        RegistryProperties.TransferFee schedule = registryProperties.fees().transfer();
        BigDecimal value = transferValue != null ? transferValue : BigDecimal.ZERO;

        BigDecimal transferTax = value.multiply(schedule.taxRate());
        BigDecimal stampDuty = value.multiply(schedule.stampDutyRate());

        Map<String, BigDecimal> breakdown = new LinkedHashMap<>();
        breakdown.put("transferTax", transferTax);
        breakdown.put("stampDuty", stampDuty);
        breakdown.put("processingFee", schedule.processingFee());

        return new FeeQuote(transferTax.add(stampDuty).add(schedule.processingFee()), currency(), breakdown);
    }

    public String currency() {
        return registryProperties.fees().currency();
    }
}
