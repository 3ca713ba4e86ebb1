package com.nosota.landregistry.api.request;

import jakarta.validation.constraints.Size;

/**
 * Optional officer notes attached to a decision.
 *
 * @param notes Free-text notes (max 1000 characters)
 */
public record NotesRequest(
        @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
        String notes
) {
}
