package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.DisputeDecision;
import jakarta.validation.constraints.Size;

/**
 * Final resolution of a dispute.
 *
 * @param decision        Outcome, mandatory
 * @param resolutionNotes Reasoning, mandatory (max 2000 characters)
 * @param actionRequired  Follow-up action for the parties (max 1000 characters)
 */
public record ResolveDisputeRequest(
        DisputeDecision decision,

        @Size(max = 2000, message = "Resolution notes cannot exceed 2000 characters")
        String resolutionNotes,

        @Size(max = 1000, message = "Action required cannot exceed 1000 characters")
        String actionRequired
) {
}
