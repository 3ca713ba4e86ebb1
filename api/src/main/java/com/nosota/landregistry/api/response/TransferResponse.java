package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.ComplianceOutcome;
import com.nosota.landregistry.api.model.RiskLevel;
import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.api.model.TransferType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for an ownership transfer.
 *
 * @param id                    Transfer UUID
 * @param propertyId            Property being transferred
 * @param transferType          Legal basis of the transfer
 * @param transferReason        Reason given at initiation
 * @param previousOwnerId       Owner at initiation time
 * @param newOwnerId            Receiving owner
 * @param transferValueAmount   Declared value
 * @param transferValueCurrency ISO 4217 code
 * @param initiatedBy           Actor who initiated the transfer
 * @param initiationDate        Initiation timestamp
 * @param status                Current status
 * @param feePaid               Transfer fee completed and verified
 * @param legalCompliance       Legal compliance outcome
 * @param taxClearance          Tax clearance outcome
 * @param fraudScreening        Fraud screening outcome
 * @param fraudRiskLevel        Risk level assigned during screening
 * @param complianceNotes       Compliance officer notes
 * @param complianceCheckedBy   Officer who recorded the compliance checks
 * @param complianceCheckedAt   When the checks were recorded
 * @param reviewedBy            Officer who approved or rejected
 * @param reviewNotes           Approval notes
 * @param rejectionReason       Rejection or cancellation reason
 * @param completionDate        When ownership was reassigned
 * @param timeline              Append-only history
 * @param documents             Documents submitted by the parties
 * @param createdAt             Creation timestamp
 * @param updatedAt             Last update timestamp
 */
public record TransferResponse(
        UUID id,
        UUID propertyId,
        TransferType transferType,
        String transferReason,
        Long previousOwnerId,
        Long newOwnerId,
        BigDecimal transferValueAmount,
        String transferValueCurrency,
        Long initiatedBy,
        LocalDateTime initiationDate,
        TransferStatus status,
        boolean feePaid,
        ComplianceOutcome legalCompliance,
        ComplianceOutcome taxClearance,
        ComplianceOutcome fraudScreening,
        RiskLevel fraudRiskLevel,
        String complianceNotes,
        Long complianceCheckedBy,
        LocalDateTime complianceCheckedAt,
        Long reviewedBy,
        String reviewNotes,
        String rejectionReason,
        LocalDateTime completionDate,
        List<TimelineEntryResponse> timeline,
        List<TransferDocumentResponse> documents,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
