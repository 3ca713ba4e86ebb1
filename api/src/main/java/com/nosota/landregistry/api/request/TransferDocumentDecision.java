package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.TransferDocumentStatus;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Officer decision on one transfer document.
 *
 * @param documentId Transfer document id
 * @param status     VERIFIED or REJECTED
 * @param notes      Review notes
 */
public record TransferDocumentDecision(
        @NotNull(message = "Document ID is required")
        UUID documentId,

        @NotNull(message = "Decision status is required")
        TransferDocumentStatus status,

        String notes
) {
}
