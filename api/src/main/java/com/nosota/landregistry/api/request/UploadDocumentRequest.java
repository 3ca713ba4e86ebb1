package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.DocumentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Metadata of a document uploaded for a property application.
 *
 * <p>The bytes themselves live in the external file store, keyed by the document id.
 *
 * @param documentType Type of the document
 * @param fileName     Original file name
 * @param fileSize     Size in bytes
 * @param mimeType     MIME type reported by the upload
 */
public record UploadDocumentRequest(
        @NotNull(message = "Document type is required")
        DocumentType documentType,

        @NotBlank(message = "File name is required")
        String fileName,

        @NotNull(message = "File size is required")
        @Positive(message = "File size must be positive")
        Long fileSize,

        @NotBlank(message = "MIME type is required")
        String mimeType
) {
}
