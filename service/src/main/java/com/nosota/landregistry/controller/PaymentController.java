package com.nosota.landregistry.controller;

import com.nosota.landregistry.api.PaymentApi;
import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.request.InitiatePaymentRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.PaymentStatusUpdateRequest;
import com.nosota.landregistry.api.response.FeeQuoteResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import com.nosota.landregistry.dto.PaymentMapper;
import com.nosota.landregistry.model.Payment;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.PaymentVerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for fee quotes and the payment sub-workflow.
 *
 * <p>Implements {@link PaymentApi}. Status updates model the callback of the external payment
 * rail; verification and rejection are staff decisions.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentController implements PaymentApi {

    private final PaymentVerificationService paymentVerificationService;

    // ==================== Fee Quotes ====================

    @Override
    public ResponseEntity<FeeQuoteResponse> quoteRegistrationFee(Long actorId, ActorRole actorRole, UUID propertyId) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(
                paymentVerificationService.quoteRegistrationFee(Actor.of(actorId, actorRole), propertyId),
                PaymentType.REGISTRATION_FEE,
                propertyId));
    }

    @Override
    public ResponseEntity<FeeQuoteResponse> quoteTransferFee(Long actorId, ActorRole actorRole, UUID transferId) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(
                paymentVerificationService.quoteTransferFee(Actor.of(actorId, actorRole), transferId),
                PaymentType.TRANSFER_FEE,
                transferId));
    }

    // ==================== Payment Lifecycle ====================

    @Override
    public ResponseEntity<PaymentResponse> initiatePayment(Long actorId, ActorRole actorRole,
                                                           InitiatePaymentRequest request) {
        log.info("Initiating {} payment: amount={}, method={}, propertyId={}, transferId={}",
                request.paymentType(), request.amount(), request.paymentMethod(),
                request.propertyId(), request.transferId());

        Payment payment = paymentVerificationService.initiatePayment(Actor.of(actorId, actorRole), request);

        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMapper.INSTANCE.toResponse(payment));
    }

    @Override
    public ResponseEntity<PaymentResponse> getPayment(Long actorId, ActorRole actorRole, UUID paymentId) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(
                paymentVerificationService.getPayment(Actor.of(actorId, actorRole), paymentId)));
    }

    @Override
    public ResponseEntity<PaymentResponse> markPaymentStatus(Long actorId, ActorRole actorRole, UUID paymentId,
                                                             PaymentStatusUpdateRequest request) {
        log.info("Payment {} reported {} by rail (transactionId={})", paymentId, request.status(), request.transactionId());
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(
                paymentVerificationService.markPaymentStatus(Actor.of(actorId, actorRole), paymentId, request)));
    }

    @Override
    public ResponseEntity<PaymentResponse> verifyPayment(Long actorId, ActorRole actorRole, UUID paymentId,
                                                         NotesRequest request) {
        log.info("Verifying payment {} by {}", paymentId, actorId);
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(
                paymentVerificationService.verifyPayment(Actor.of(actorId, actorRole), paymentId, request.notes())));
    }

    @Override
    public ResponseEntity<PaymentResponse> rejectPayment(Long actorId, ActorRole actorRole, UUID paymentId,
                                                         NotesRequest request) {
        log.info("Rejecting payment {} by {}", paymentId, actorId);
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponse(
                paymentVerificationService.rejectPayment(Actor.of(actorId, actorRole), paymentId, request.notes())));
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<PagedResponse<PaymentResponse>> listPendingPayments(Long actorId, ActorRole actorRole,
                                                                              int page, int size) {
        Page<Payment> payments =
                paymentVerificationService.listPendingPayments(Actor.of(actorId, actorRole), page, size);
        return ResponseEntity.ok(new PagedResponse<>(
                PaymentMapper.INSTANCE.toResponseList(payments.getContent()),
                payments.getNumber(),
                payments.getSize(),
                payments.getTotalElements()));
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> listPropertyPayments(Long actorId, ActorRole actorRole, UUID propertyId) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponseList(
                paymentVerificationService.listPropertyPayments(Actor.of(actorId, actorRole), propertyId)));
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> listTransferPayments(Long actorId, ActorRole actorRole, UUID transferId) {
        return ResponseEntity.ok(PaymentMapper.INSTANCE.toResponseList(
                paymentVerificationService.listTransferPayments(Actor.of(actorId, actorRole), transferId)));
    }
}
