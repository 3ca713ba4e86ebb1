package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.PropertyStatus;

import java.util.List;
import java.util.UUID;

/**
 * Workflow progress of a property application.
 *
 * @param propertyId         Application UUID
 * @param status             Composite status
 * @param documentsValidated Documents flag after recomputation
 * @param paymentCompleted   Payment flag after recomputation
 * @param readyForApproval   Both flags set and the application is not terminal
 * @param missingConditions  Conditions still blocking approval
 * @param nextStep           Hint for the next action in the workflow
 */
public record WorkflowStatusResponse(
        UUID propertyId,
        PropertyStatus status,
        boolean documentsValidated,
        boolean paymentCompleted,
        boolean readyForApproval,
        List<String> missingConditions,
        String nextStep
) {
}
