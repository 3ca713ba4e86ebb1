package com.nosota.landregistry.api.request;

import com.nosota.landregistry.api.model.ComplianceOutcome;
import com.nosota.landregistry.api.model.RiskLevel;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Compliance checklist recorded by an officer for a transfer.
 *
 * @param legalCompliance Compliance with land law
 * @param taxClearance    Outstanding taxes cleared
 * @param fraudScreening  Fraud screening outcome
 * @param fraudRiskLevel  Risk level assigned during screening
 * @param notes           Officer notes
 */
public record ComplianceCheckRequest(
        @NotNull(message = "Legal compliance outcome is required")
        ComplianceOutcome legalCompliance,

        @NotNull(message = "Tax clearance outcome is required")
        ComplianceOutcome taxClearance,

        @NotNull(message = "Fraud screening outcome is required")
        ComplianceOutcome fraudScreening,

        RiskLevel fraudRiskLevel,

        @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
        String notes
) {
}
