package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.PropertyType;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Request DTO for editing a PENDING application. Null fields keep their current value.
 * The plot number is not editable.
 *
 * @param kebele       New kebele
 * @param subCity      New sub-city
 * @param latitude     New latitude
 * @param longitude    New longitude
 * @param area         New area in square metres (must be positive)
 * @param propertyType New property type
 */
public record UpdatePropertyRequest(
        String kebele,

        String subCity,

        Double latitude,

        Double longitude,

        @Positive(message = "Area must be a positive number")
        BigDecimal area,

        PropertyType propertyType
) {
}
