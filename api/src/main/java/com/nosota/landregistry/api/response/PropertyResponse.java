package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.model.PropertyType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a property registration application.
 *
 * <p>{@code documentsValidated} and {@code paymentCompleted} are derived flags. They are
 * recomputed from the stored documents and payments after every sub-workflow transition.
 *
 * @param id                 Application UUID
 * @param plotNumber         Plot number as submitted
 * @param kebele             Kebele of the plot
 * @param subCity            Sub-city of the plot
 * @param latitude           Optional latitude
 * @param longitude          Optional longitude
 * @param area               Area in square metres
 * @param propertyType       Property type
 * @param ownerId            Current owner actor id
 * @param ownerSince         When the current owner acquired the property
 * @param status             Composite status
 * @param documentsValidated All required documents verified, none rejected
 * @param paymentCompleted   Registration fee completed and verified
 * @param reviewStarted      An officer has started working on the application
 * @param reviewedBy         Officer who approved or rejected
 * @param reviewNotes        Approval notes or rejection reason
 * @param reviewedAt         Decision timestamp
 * @param currentTransferId  Active transfer, if any
 * @param hasActiveDispute   At least one dispute is open against the property
 * @param createdAt          Submission timestamp
 * @param updatedAt          Last update timestamp
 */
public record PropertyResponse(
        UUID id,
        String plotNumber,
        String kebele,
        String subCity,
        Double latitude,
        Double longitude,
        BigDecimal area,
        PropertyType propertyType,
        Long ownerId,
        LocalDateTime ownerSince,
        PropertyStatus status,
        boolean documentsValidated,
        boolean paymentCompleted,
        boolean reviewStarted,
        Long reviewedBy,
        String reviewNotes,
        LocalDateTime reviewedAt,
        UUID currentTransferId,
        boolean hasActiveDispute,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
