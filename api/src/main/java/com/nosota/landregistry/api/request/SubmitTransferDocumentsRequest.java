package com.nosota.landregistry.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Documents submitted by one of the transfer parties.
 */
public record SubmitTransferDocumentsRequest(
        @NotEmpty(message = "Documents must not be empty")
        List<@Valid TransferDocumentSubmission> documents
) {
}
