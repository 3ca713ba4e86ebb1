package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.request.InitiatePaymentRequest;
import com.nosota.landregistry.api.request.PaymentStatusUpdateRequest;
import com.nosota.landregistry.dto.FeeQuote;
import com.nosota.landregistry.dto.PaymentScope;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidAmountException;
import com.nosota.landregistry.error.NotFoundException;
import com.nosota.landregistry.error.WorkflowValidationException;
import com.nosota.landregistry.event.WorkflowEventPublisher;
import com.nosota.landregistry.model.Payment;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.model.Transfer;
import com.nosota.landregistry.repository.PaymentRepository;
import com.nosota.landregistry.security.AccessGuard;
import com.nosota.landregistry.security.Actor;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Payment sub-workflow: fee quotes, initiation, rail status updates and officer verification.
 *
 * <p>Payments belong either to a property application or to a transfer. Every transition locks
 * that aggregate before the payment row. Verifying a registration fee recomputes the application's
 * {@code paymentCompleted} flag. Verifying a transfer fee marks the transfer's fee as paid.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentVerificationService {

    private static final DateTimeFormatter RECEIPT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String RECEIPT_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final PaymentRepository paymentRepository;
    private final PropertyApplicationService propertyApplicationService;
    private final TransferService transferService;
    private final FeeCalculationService feeCalculationService;
    private final PaymentStatusStateMachine paymentStatusStateMachine;
    private final WorkflowEventPublisher workflowEventPublisher;
    private final Clock clock;

    public FeeQuote quoteRegistrationFee(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = propertyApplicationService.findApplication(propertyId);
        applicationGuard(application).check(actor);
        return feeCalculationService.registrationFee(application.getPropertyType(), application.getArea());
    }

    public FeeQuote quoteTransferFee(@NotNull Actor actor, @NotNull UUID transferId) {
        Transfer transfer = transferService.findTransfer(transferId);
        TransferService.readGuard(transfer).check(actor);
        return feeCalculationService.transferFee(transfer.getTransferValueAmount());
    }

    /**
     * Records a new PENDING payment against an application or a transfer.
     *
     * @throws WorkflowValidationException if the scope is missing, ambiguous or does not fit the payment type
     * @throws InvalidAmountException      if the amount is zero or negative
     * @throws ConflictException           if the application is rejected, or the fee is already paid
     */
    @Transactional
    public Payment initiatePayment(@NotNull Actor actor, @NotNull InitiatePaymentRequest request) {
        if ((request.propertyId() == null) == (request.transferId() == null)) {
            throw new WorkflowValidationException("Exactly one of propertyId and transferId must be set");
        }
        boolean transferScoped = request.transferId() != null;
        if (request.paymentType().isTransferScoped() != transferScoped) {
            throw new WorkflowValidationException(String.format("%s is paid against a %s",
                    request.paymentType(), request.paymentType().isTransferScoped() ? "transfer" : "property application"));
        }

        UUID propertyId;
        if (transferScoped) {
            Transfer transfer = transferService.lockTransfer(request.transferId());
            AccessGuard.anyParty(transfer.getPreviousOwnerId(), transfer.getNewOwnerId()).check(actor);
            requirePositive(request.amount());
            if (transfer.getStatus().isTerminal()) {
                throw new ConflictException(String.format("Transfer %s is already %s", transfer.getId(), transfer.getStatus()));
            }
            if (transfer.isFeePaid()) {
                throw new ConflictException("Transfer fee of transfer " + transfer.getId() + " is already paid");
            }
            propertyId = transfer.getPropertyId();
        } else {
            PropertyApplication application = propertyApplicationService.lockApplication(request.propertyId());
            AccessGuard.owner(application.getOwnerId()).check(actor);
            requirePositive(request.amount());
            if (application.getStatus() == PropertyStatus.REJECTED) {
                throw new ConflictException("Property application " + application.getId() + " is REJECTED");
            }
            if (request.paymentType() == PaymentType.REGISTRATION_FEE && application.isPaymentCompleted()) {
                throw new ConflictException("Registration fee of application " + application.getId() + " is already paid");
            }
            propertyId = application.getId();
        }

        LocalDateTime now = LocalDateTime.now(clock);

        Payment payment = new Payment();
        payment.setPropertyId(transferScoped ? null : propertyId);
        payment.setTransferId(request.transferId());
        payment.setPayerId(actor.id());
        payment.setAmount(request.amount());
        payment.setCurrency(request.currency() != null ? request.currency() : feeCalculationService.currency());
        payment.setPaymentType(request.paymentType());
        payment.setPaymentMethod(request.paymentMethod());
        payment.setPaymentMethodDetails(request.paymentMethodDetails() != null
                ? new HashMap<>(request.paymentMethodDetails()) : new HashMap<>());
        payment.setStatus(PaymentStatus.PENDING);
        payment.setVerificationStatus(PaymentVerificationStatus.UNSET);
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);
        payment = paymentRepository.save(payment);

        log.info("Payment {} of {} {} initiated for {} by {}", payment.getId(), payment.getAmount(),
                payment.getCurrency(), payment.getPaymentType(), actor);
        workflowEventPublisher.publish(AuditEntityType.PAYMENT, payment.getId(), propertyId,
                "PAYMENT_INITIATED", null, PaymentStatus.PENDING, actor, payment.getPaymentType().name());
        return payment;
    }

    /**
     * Applies the outcome reported by the payment rail. Completion stamps the completion time and
     * a receipt number.
     *
     * @throws WorkflowValidationException if the target is PENDING
     * @throws ConflictException           if the payment already left PENDING, or the transaction id is taken
     */
    @Transactional
    public Payment markPaymentStatus(@NotNull Actor actor, @NotNull UUID paymentId,
                                     @NotNull PaymentStatusUpdateRequest request) {
        UUID propertyId = lockScope(paymentId);
        Payment payment = lockPayment(paymentId);
        AccessGuard.owner(payment.getPayerId()).or(AccessGuard.STAFF).check(actor);

        PaymentStatus fromStatus = payment.getStatus();
        paymentStatusStateMachine.validateRailTransition(fromStatus, request.status());

        LocalDateTime now = LocalDateTime.now(clock);
        if (request.status() == PaymentStatus.COMPLETED) {
            String transactionId = request.transactionId();
            if (transactionId != null && !transactionId.isBlank()) {
                if (paymentRepository.existsByTransactionId(transactionId)) {
                    throw new ConflictException("Transaction id " + transactionId + " is already recorded on another payment");
                }
                payment.setTransactionId(transactionId);
            }
            payment.setCompletedAt(now);
            payment.setReceiptNumber(receiptNumber(now));
        }
        payment.setStatus(request.status());
        payment.setUpdatedAt(now);

        log.info("Payment {}: {} → {}", paymentId, fromStatus, request.status());
        workflowEventPublisher.publish(AuditEntityType.PAYMENT, paymentId, propertyId,
                request.status() == PaymentStatus.COMPLETED ? "PAYMENT_COMPLETED" : "PAYMENT_FAILED",
                fromStatus, request.status(), actor, payment.getTransactionId());
        return payment;
    }

    /**
     * Verifies a completed payment.
     *
     * <p>Registration and transfer fees must equal the computed fee exactly. There is no rounding
     * and no tolerance.
     *
     * @throws com.nosota.landregistry.error.InvalidStateException if the payment is not COMPLETED
     * @throws ConflictException           if the payment was already verified or rejected, or its
     *                                     application is already approved or rejected
     * @throws WorkflowValidationException if the amount or currency does not match the fee
     */
    @Transactional
    public Payment verifyPayment(@NotNull Actor actor, @NotNull UUID paymentId, String notes) {
        PaymentScope scope = findScope(paymentId);
        if (scope.isTransferScoped()) {
            Transfer transfer = transferService.lockTransfer(scope.transferId());
            Payment payment = lockPayment(paymentId);
            AccessGuard.STAFF.check(actor);
            paymentStatusStateMachine.validateVerification(payment.getStatus(), payment.getVerificationStatus());
            if (transfer.getStatus().isTerminal()) {
                throw new ConflictException(String.format("Transfer %s is already %s", transfer.getId(), transfer.getStatus()));
            }
            requireExpectedAmount(payment, feeCalculationService.transferFee(transfer.getTransferValueAmount()));

            decide(actor, payment, PaymentVerificationStatus.VERIFIED, notes, transfer.getPropertyId());
            if (payment.getPaymentType() == PaymentType.TRANSFER_FEE && !transfer.isFeePaid()) {
                transferService.recordFeePaid(transfer, actor);
            }
            return payment;
        }

        PropertyApplication application = propertyApplicationService.lockApplication(scope.propertyId());
        Payment payment = lockPayment(paymentId);
        AccessGuard.STAFF.check(actor);
        paymentStatusStateMachine.validateVerification(payment.getStatus(), payment.getVerificationStatus());
        propertyApplicationService.requireOpen(application);
        if (payment.getPaymentType() == PaymentType.REGISTRATION_FEE) {
            requireExpectedAmount(payment,
                    feeCalculationService.registrationFee(application.getPropertyType(), application.getArea()));
        }

        decide(actor, payment, PaymentVerificationStatus.VERIFIED, notes, application.getId());
        propertyApplicationService.markReviewStarted(application);
        propertyApplicationService.refreshAggregate(application);
        return payment;
    }

    /**
     * @throws WorkflowValidationException if no notes are given
     * @throws ConflictException           if the application of a property-scoped payment is closed
     */
    @Transactional
    public Payment rejectPayment(@NotNull Actor actor, @NotNull UUID paymentId, String notes) {
        PaymentScope scope = findScope(paymentId);
        Optional<PropertyApplication> application = Optional.empty();
        UUID propertyId;
        if (scope.isTransferScoped()) {
            propertyId = transferService.lockTransfer(scope.transferId()).getPropertyId();
        } else {
            application = Optional.of(propertyApplicationService.lockApplication(scope.propertyId()));
            propertyId = scope.propertyId();
        }
        Payment payment = lockPayment(paymentId);
        AccessGuard.STAFF.check(actor);

        if (notes == null || notes.isBlank()) {
            throw new WorkflowValidationException("Notes are required when rejecting a payment");
        }
        paymentStatusStateMachine.validateVerification(payment.getStatus(), payment.getVerificationStatus());
        application.ifPresent(propertyApplicationService::requireOpen);

        decide(actor, payment, PaymentVerificationStatus.REJECTED, notes, propertyId);
        application.ifPresent(locked -> {
            propertyApplicationService.markReviewStarted(locked);
            propertyApplicationService.refreshAggregate(locked);
        });
        return payment;
    }

    public Payment getPayment(@NotNull Actor actor, @NotNull UUID paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
        AccessGuard.owner(payment.getPayerId()).or(AccessGuard.STAFF).check(actor);
        return payment;
    }

    public List<Payment> listPropertyPayments(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = propertyApplicationService.findApplication(propertyId);
        applicationGuard(application).check(actor);
        return paymentRepository.findByPropertyIdOrderByCreatedAtAsc(propertyId);
    }

    public List<Payment> listTransferPayments(@NotNull Actor actor, @NotNull UUID transferId) {
        Transfer transfer = transferService.findTransfer(transferId);
        TransferService.readGuard(transfer).check(actor);
        return paymentRepository.findByTransferIdOrderByCreatedAtAsc(transferId);
    }

    /**
     * Officer work queue: payments the rail reported COMPLETED that nobody has verified or
     * rejected yet, oldest completion first.
     */
    public Page<Payment> listPendingPayments(@NotNull Actor actor, int page, int size) {
        AccessGuard.STAFF.check(actor);
        return paymentRepository.findByStatusAndVerificationStatusOrderByCompletedAtAsc(
                PaymentStatus.COMPLETED, PaymentVerificationStatus.UNSET, PageRequest.of(page, size));
    }

    private void decide(Actor actor, Payment payment, PaymentVerificationStatus verificationStatus,
                        String notes, UUID propertyId) {
        LocalDateTime now = LocalDateTime.now(clock);
        payment.setVerificationStatus(verificationStatus);
        payment.setNotes(notes);
        payment.setVerifiedBy(actor.id());
        payment.setVerifiedAt(now);
        payment.setUpdatedAt(now);

        log.info("Payment {} {} by {}", payment.getId(), verificationStatus, actor);
        workflowEventPublisher.publish(AuditEntityType.PAYMENT, payment.getId(), propertyId,
                verificationStatus == PaymentVerificationStatus.VERIFIED ? "PAYMENT_VERIFIED" : "PAYMENT_REJECTED",
                PaymentVerificationStatus.UNSET, verificationStatus, actor, notes);
    }

    /**
     * Locks the aggregate owning the payment and returns its property id.
     */
    private UUID lockScope(UUID paymentId) {
        PaymentScope scope = findScope(paymentId);
        if (scope.isTransferScoped()) {
            return transferService.lockTransfer(scope.transferId()).getPropertyId();
        }
        return propertyApplicationService.lockApplication(scope.propertyId()).getId();
    }

    private PaymentScope findScope(UUID paymentId) {
        return paymentRepository.findScopeById(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
    }

    private Payment lockPayment(UUID paymentId) {
        return paymentRepository.getOneForUpdate(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new InvalidAmountException(amount);
        }
    }

    private static void requireExpectedAmount(Payment payment, FeeQuote expected) {
        if (payment.getAmount().compareTo(expected.amount()) != 0 || !expected.currency().equals(payment.getCurrency())) {
            throw new WorkflowValidationException(String.format(
                    "Paid amount %s %s does not match the %s of %s %s",
                    payment.getAmount(), payment.getCurrency(), payment.getPaymentType(),
                    expected.amount(), expected.currency()));
        }
    }

    private static AccessGuard applicationGuard(PropertyApplication application) {
        return AccessGuard.ownerOrAnyOf(application.getOwnerId(), ActorRole.LAND_OFFICER, ActorRole.ADMIN);
    }

    private static String receiptNumber(LocalDateTime at) {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(RECEIPT_ALPHABET.charAt(RANDOM.nextInt(RECEIPT_ALPHABET.length())));
        }
        return "RCP-" + RECEIPT_DATE.format(at) + "-" + suffix;
    }
}
