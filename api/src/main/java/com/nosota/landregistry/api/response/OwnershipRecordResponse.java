package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.TransferType;

import java.time.LocalDateTime;
import java.util.UUID;

public record OwnershipRecordResponse(
        UUID id,
        UUID propertyId,
        Long ownerId,
        LocalDateTime startDate,
        LocalDateTime endDate,
        TransferType acquisitionType,
        UUID transferId
) {
}
