package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.request.InitiatePaymentRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.PaymentStatusUpdateRequest;
import com.nosota.landregistry.api.response.FeeQuoteResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Payment verification API.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Fee quotes for registration and transfer fees</li>
 *   <li>Initiating payments and reporting the payment rail outcome</li>
 *   <li>Officer verification and rejection of completed payments</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>PaymentController - in service module (server-side implementation)</li>
 *   <li>PaymentClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/payments")
public interface PaymentApi {

    // ==================== Fee Quotes ====================

    /**
     * Registration fee for an application: base fee of the property type plus area times rate.
     *
     * @param propertyId The application ID
     * @return Fee quote with breakdown
     */
    @GetMapping("/properties/{propertyId}/fee-quote")
    ResponseEntity<FeeQuoteResponse> quoteRegistrationFee(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    /**
     * Transfer fee: transfer tax and stamp duty on the declared value plus a processing fee.
     *
     * @param transferId The transfer ID
     * @return Fee quote with breakdown
     */
    @GetMapping("/transfers/{transferId}/fee-quote")
    ResponseEntity<FeeQuoteResponse> quoteTransferFee(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId);

    // ==================== Payment Lifecycle ====================

    /**
     * Creates a PENDING payment for an application or a transfer.
     *
     * <p>Fails with INVALID_AMOUNT when the amount is not positive.
     *
     * @param request Scope, amount, type and method
     * @return Created payment
     */
    @PostMapping
    ResponseEntity<PaymentResponse> initiatePayment(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid InitiatePaymentRequest request);

    @GetMapping("/{paymentId}")
    ResponseEntity<PaymentResponse> getPayment(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("paymentId") UUID paymentId);

    /**
     * Records the payment rail outcome. COMPLETED and FAILED are only reachable from PENDING.
     *
     * @param paymentId The payment ID
     * @param request   Target status and rail transaction id
     * @return Updated payment
     */
    @PostMapping("/{paymentId}/status")
    ResponseEntity<PaymentResponse> markPaymentStatus(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody @Valid PaymentStatusUpdateRequest request);

    /**
     * Verifies a COMPLETED payment against the computed fee.
     *
     * @param paymentId The payment ID
     * @param request   Optional verification notes
     * @return Verified payment
     */
    @PostMapping("/{paymentId}/verify")
    ResponseEntity<PaymentResponse> verifyPayment(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody @Valid NotesRequest request);

    @PostMapping("/{paymentId}/reject")
    ResponseEntity<PaymentResponse> rejectPayment(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody @Valid NotesRequest request);

    // ==================== Queries ====================

    /**
     * Completed payments waiting for officer verification, oldest first. Land officers and admins only.
     *
     * @param page Page number (0-indexed)
     * @param size Page size
     * @return Paginated verification queue
     */
    @GetMapping("/pending")
    ResponseEntity<PagedResponse<PaymentResponse>> listPendingPayments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    @GetMapping("/properties/{propertyId}")
    ResponseEntity<List<PaymentResponse>> listPropertyPayments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("propertyId") UUID propertyId);

    @GetMapping("/transfers/{transferId}")
    ResponseEntity<List<PaymentResponse>> listTransferPayments(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @PathVariable("transferId") UUID transferId);
}
