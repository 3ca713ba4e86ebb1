package com.nosota.landregistry.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Metadata of a replacement file for an existing document.
 */
public record ReplaceDocumentRequest(
        @NotBlank(message = "File name is required")
        String fileName,

        @NotNull(message = "File size is required")
        @Positive(message = "File size must be positive")
        Long fileSize,

        @NotBlank(message = "MIME type is required")
        String mimeType
) {
}
