package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.DisputeType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record FileDisputeRequest(
        @NotNull(message = "Property ID is required")
        UUID propertyId,

        @NotNull(message = "Dispute type is required")
        DisputeType disputeType,

        @NotBlank(message = "Dispute title is required")
        @Size(max = 200, message = "Title cannot exceed 200 characters")
        String title,

        @NotBlank(message = "Dispute description is required")
        @Size(max = 2000, message = "Description cannot exceed 2000 characters")
        String description
) {
}
