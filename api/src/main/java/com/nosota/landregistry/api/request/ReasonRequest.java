package com.nosota.landregistry.api.request;

import jakarta.validation.constraints.Size;

/**
 * Reason for a rejection, cancellation or withdrawal.
 *
 * <p>Blank reasons are refused by the workflow with a VALIDATION_ERROR where a reason is mandatory.
 *
 * @param reason Reason text (max 1000 characters)
 */
public record ReasonRequest(
        @Size(max = 1000, message = "Reason cannot exceed 1000 characters")
        String reason
) {
}
