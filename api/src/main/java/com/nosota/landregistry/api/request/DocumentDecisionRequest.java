package com.nosota.landregistry.api.request;

import jakarta.validation.constraints.Size;

/**
 * Officer decision on a document.
 *
 * @param notes    Verification notes; mandatory when rejecting
 * @param reverify Must be true to change a document that is already VERIFIED or REJECTED
 */
public record DocumentDecisionRequest(
        @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
        String notes,

        boolean reverify
) {
}
