package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.api.model.DocumentType;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a document attached to a property application.
 *
 * @param fileVersion Incremented every time the owner replaces the file
 */
public record DocumentResponse(
        UUID id,
        UUID propertyId,
        Long ownerId,
        DocumentType documentType,
        String fileName,
        Long fileSize,
        String mimeType,
        DocumentStatus status,
        String notes,
        Long reviewedBy,
        LocalDateTime reviewedAt,
        int fileVersion,
        LocalDateTime uploadedAt,
        LocalDateTime updatedAt
) {
}
