package com.nosota.landregistry;

import com.nosota.landregistry.api.model.DocumentType;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.config.RegistryProperties;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Registry configuration used by unit tests, same values as application.yml.
 */
public final class RegistryFixtures {

    private RegistryFixtures() {
    }

    public static RegistryProperties registryProperties() {
        Set<DocumentType> basic = EnumSet.of(DocumentType.TITLE_DEED, DocumentType.ID_CARD, DocumentType.APPLICATION_FORM);
        Set<DocumentType> withTax = EnumSet.of(DocumentType.TITLE_DEED, DocumentType.ID_CARD,
                DocumentType.APPLICATION_FORM, DocumentType.TAX_CLEARANCE);

        RegistryProperties.Documents documents = new RegistryProperties.Documents(Map.of(
                PropertyType.RESIDENTIAL, basic,
                PropertyType.AGRICULTURAL, basic,
                PropertyType.COMMERCIAL, withTax,
                PropertyType.INDUSTRIAL, withTax));

        RegistryProperties.Fees fees = new RegistryProperties.Fees("ETB", Map.of(
                PropertyType.RESIDENTIAL, fee("2500", "20"),
                PropertyType.COMMERCIAL, fee("5000", "35"),
                PropertyType.INDUSTRIAL, fee("7500", "30"),
                PropertyType.AGRICULTURAL, fee("1000", "5")),
                new RegistryProperties.TransferFee(new BigDecimal("0.03"), new BigDecimal("0.005"), new BigDecimal("300")));

        return new RegistryProperties(documents, fees, new RegistryProperties.Notification(3, 1, 1.0));
    }

    private static RegistryProperties.RegistrationFee fee(String base, String rate) {
        return new RegistryProperties.RegistrationFee(new BigDecimal(base), new BigDecimal(rate));
    }
}
