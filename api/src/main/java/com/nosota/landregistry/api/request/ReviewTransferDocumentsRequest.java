package com.nosota.landregistry.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ReviewTransferDocumentsRequest(
        @NotEmpty(message = "At least one document decision is required")
        List<@Valid TransferDocumentDecision> decisions
) {
}
