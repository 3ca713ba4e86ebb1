package com.nosota.landregistry.api.request;

import jakarta.validation.constraints.NotNull;

public record AssignDisputeRequest(
        @NotNull(message = "Officer ID is required")
        Long officerId,

        String notes
) {
}
