package com.nosota.landregistry.service;

import com.nosota.landregistry.RegistryFixtures;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.dto.FeeQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Fee schedule")
class FeeCalculationServiceTest {

    private final FeeCalculationService feeCalculationService =
            new FeeCalculationService(RegistryFixtures.registryProperties());

    @Test
    @DisplayName("Residential 250 m² costs 2500 + 250 × 20 = 7500 ETB")
    void residentialRegistrationFee() {
        FeeQuote quote = feeCalculationService.registrationFee(PropertyType.RESIDENTIAL, new BigDecimal("250"));

        assertThat(quote.amount()).isEqualByComparingTo("7500");
        assertThat(quote.currency()).isEqualTo("ETB");
        assertThat(quote.breakdown()).containsOnlyKeys("baseFee", "areaFee");
        assertThat(quote.breakdown().get("areaFee")).isEqualByComparingTo("5000");
    }

    @Test
    @DisplayName("Fractional areas are not rounded")
    void fractionalArea() {
        FeeQuote quote = feeCalculationService.registrationFee(PropertyType.AGRICULTURAL, new BigDecimal("100.25"));

        assertThat(quote.amount()).isEqualByComparingTo("1501.25");
    }

    @Test
    @DisplayName("Transfer fee is 3.5% of the value plus 300 processing")
    void transferFee() {
        FeeQuote quote = feeCalculationService.transferFee(new BigDecimal("1000000"));

        assertThat(quote.amount()).isEqualByComparingTo("35300");
        assertThat(quote.breakdown().get("transferTax")).isEqualByComparingTo("30000");
        assertThat(quote.breakdown().get("stampDuty")).isEqualByComparingTo("5000");
        assertThat(quote.breakdown().get("processingFee")).isEqualByComparingTo("300");
    }

    @Test
    @DisplayName("Gifts without a declared value pay the processing fee only")
    void transferWithoutValue() {
        assertThat(feeCalculationService.transferFee(null).amount()).isEqualByComparingTo("300");
    }
}
