package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.PropertyType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for submitting a property registration application.
 *
 * @param plotNumber   Plot number, unique across the registry regardless of case
 * @param kebele       Kebele of the plot
 * @param subCity      Sub-city of the plot
 * @param latitude     Optional latitude
 * @param longitude    Optional longitude
 * @param area         Area in square metres (must be positive)
 * @param propertyType Property type, drives the required document set and the fee
 */
public record SubmitPropertyRequest(
        @NotBlank(message = "Plot number is required")
        @Size(max = 50, message = "Plot number cannot exceed 50 characters")
        String plotNumber,

        @NotBlank(message = "Kebele is required")
        String kebele,

        @NotBlank(message = "Sub-city is required")
        String subCity,

        Double latitude,

        Double longitude,

        @NotNull(message = "Area is required")
        @Positive(message = "Area must be a positive number")
        BigDecimal area,

        @NotNull(message = "Property type is required")
        PropertyType propertyType
) {
}
