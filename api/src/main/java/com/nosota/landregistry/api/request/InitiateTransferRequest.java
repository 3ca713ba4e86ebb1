package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.TransferType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for initiating an ownership transfer of a registered property.
 *
 * @param propertyId            Approved property application
 * @param transferType          Legal basis of the transfer
 * @param newOwnerId            Actor id of the new owner
 * @param transferValueAmount   Declared value, zero for gifts and inheritance
 * @param transferValueCurrency ISO 4217 code, ETB when omitted
 * @param transferReason        Reason for the transfer (max 1000 characters)
 */
public record InitiateTransferRequest(
        @NotNull(message = "Property ID is required")
        UUID propertyId,

        @NotNull(message = "Transfer type is required")
        TransferType transferType,

        @NotNull(message = "New owner is required")
        Long newOwnerId,

        @PositiveOrZero(message = "Transfer value must not be negative")
        BigDecimal transferValueAmount,

        @Size(min = 3, max = 3, message = "Currency must be a 3-letter ISO code")
        String transferValueCurrency,

        @NotBlank(message = "Transfer reason is required")
        @Size(max = 1000, message = "Transfer reason cannot exceed 1000 characters")
        String transferReason
) {
}
