package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.DisputeDecision;
import com.nosota.landregistry.api.model.DisputePriority;
import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.api.model.DisputeType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a dispute.
 *
 * <p>{@code priority} is computed at read time from the dispute type and age. It is never stored.
 */
public record DisputeResponse(
        UUID id,
        UUID propertyId,
        Long disputantId,
        DisputeType disputeType,
        String title,
        String description,
        Long assignedTo,
        LocalDateTime assignedAt,
        DisputeStatus status,
        DisputePriority priority,
        List<TimelineEntryResponse> timeline,
        DisputeDecision decision,
        String resolutionNotes,
        String actionRequired,
        Long resolvedBy,
        LocalDateTime resolutionDate,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
