package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.TransferDocumentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record TransferDocumentSubmission(
        @NotNull(message = "Document type is required")
        TransferDocumentType documentType,

        @NotBlank(message = "File name is required")
        String fileName,

        @NotNull(message = "File size is required")
        @Positive(message = "File size must be positive")
        Long fileSize,

        @NotBlank(message = "MIME type is required")
        String mimeType
) {
}
