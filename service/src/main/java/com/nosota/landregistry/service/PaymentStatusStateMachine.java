package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidStateException;
import com.nosota.landregistry.error.WorkflowValidationException;
import org.springframework.stereotype.Component;

/**
 * Transition rules of a payment.
 *
 * <p>State diagram:
 * <pre>
 * status:              PENDING → COMPLETED | FAILED
 * verificationStatus:  UNSET → VERIFIED | REJECTED   (only once status = COMPLETED)
 * </pre>
 */
@Component
public class PaymentStatusStateMachine {

    /**
     * Validates a status reported by the payment rail.
     *
     * @throws WorkflowValidationException if the target is PENDING
     * @throws ConflictException           if the payment already left PENDING
     */
    public void validateRailTransition(PaymentStatus fromStatus, PaymentStatus toStatus) {
        if (toStatus == PaymentStatus.PENDING) {
            throw new WorkflowValidationException("Payment status can only be set to COMPLETED or FAILED");
        }
        if (fromStatus != PaymentStatus.PENDING) {
            throw new ConflictException(String.format(
                    "Payment is already %s; %s is only reachable from PENDING", fromStatus, toStatus));
        }
    }

    /**
     * Validates an officer verification decision.
     *
     * @throws InvalidStateException if the payment is not COMPLETED
     * @throws ConflictException     if the payment was already verified or rejected
     */
    public void validateVerification(PaymentStatus status, PaymentVerificationStatus verificationStatus) {
        if (status != PaymentStatus.COMPLETED) {
            throw new InvalidStateException(String.format(
                    "Payment must be COMPLETED before verification, current status: %s", status));
        }
        if (verificationStatus != PaymentVerificationStatus.UNSET) {
            throw new ConflictException("Payment verification is already " + verificationStatus);
        }
    }
}
