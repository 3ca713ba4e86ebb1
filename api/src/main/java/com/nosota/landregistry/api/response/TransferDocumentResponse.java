package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.TransferDocumentStatus;
import com.nosota.landregistry.api.model.TransferDocumentType;

import java.time.LocalDateTime;
import java.util.UUID;

public record TransferDocumentResponse(
        UUID id,
        UUID transferId,
        Long submittedBy,
        TransferDocumentType documentType,
        String fileName,
        Long fileSize,
        String mimeType,
        TransferDocumentStatus status,
        String notes,
        Long reviewedBy,
        LocalDateTime reviewedAt,
        LocalDateTime submittedAt
) {
}
