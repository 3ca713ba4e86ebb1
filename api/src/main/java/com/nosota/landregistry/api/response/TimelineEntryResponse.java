package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.ActorRole;

import java.time.LocalDateTime;

public record TimelineEntryResponse(
        String action,
        String notes,
        Long performedBy,
        ActorRole performedByRole,
        LocalDateTime timestamp
) {
}
