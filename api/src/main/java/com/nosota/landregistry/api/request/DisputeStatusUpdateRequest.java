package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.DisputeStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Officer status change of a dispute.
 *
 * @param status Target status
 * @param notes  Mandatory notes, appended to the dispute timeline
 */
public record DisputeStatusUpdateRequest(
        @NotNull(message = "Status is required")
        DisputeStatus status,

        @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
        String notes
) {
}
