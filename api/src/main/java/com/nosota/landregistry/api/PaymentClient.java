package com.nosota.landregistry.api;

import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.request.InitiatePaymentRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.PaymentStatusUpdateRequest;
import com.nosota.landregistry.api.response.FeeQuoteResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of PaymentApi.
 *
 * <p>Payment rail integrations use {@link #markPaymentStatus} to report the outcome of a payment.
 * Not a Spring bean, see {@link PropertyClient} for the registration example.
 */
@RequiredArgsConstructor
@Slf4j
public class PaymentClient implements PaymentApi {

    private final WebClient webClient;

    // ==================== Fee Quotes ====================

    @Override
    public ResponseEntity<FeeQuoteResponse> quoteRegistrationFee(Long actorId, ActorRole actorRole,
                                                                 UUID propertyId) {
        log.debug("Calling quoteRegistrationFee: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/payments/properties/{propertyId}/fee-quote", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(FeeQuoteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<FeeQuoteResponse> quoteTransferFee(Long actorId, ActorRole actorRole, UUID transferId) {
        log.debug("Calling quoteTransferFee: transferId={}", transferId);

        return webClient.get()
                .uri("/api/v1/payments/transfers/{transferId}/fee-quote", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(FeeQuoteResponse.class)
                .block();
    }

    // ==================== Payment Lifecycle ====================

    @Override
    public ResponseEntity<PaymentResponse> initiatePayment(Long actorId, ActorRole actorRole,
                                                           InitiatePaymentRequest request) {
        log.debug("Calling initiatePayment: propertyId={}, transferId={}, amount={}, type={}",
                request.propertyId(), request.transferId(), request.amount(), request.paymentType());

        return webClient.post()
                .uri("/api/v1/payments")
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> getPayment(Long actorId, ActorRole actorRole, UUID paymentId) {
        log.debug("Calling getPayment: paymentId={}", paymentId);

        return webClient.get()
                .uri("/api/v1/payments/{paymentId}", paymentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> markPaymentStatus(Long actorId, ActorRole actorRole, UUID paymentId,
                                                             PaymentStatusUpdateRequest request) {
        log.debug("Calling markPaymentStatus: paymentId={}, status={}, transactionId={}",
                paymentId, request.status(), request.transactionId());

        return webClient.post()
                .uri("/api/v1/payments/{paymentId}/status", paymentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> verifyPayment(Long actorId, ActorRole actorRole, UUID paymentId,
                                                         NotesRequest request) {
        log.debug("Calling verifyPayment: paymentId={}", paymentId);

        return webClient.post()
                .uri("/api/v1/payments/{paymentId}/verify", paymentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> rejectPayment(Long actorId, ActorRole actorRole, UUID paymentId,
                                                         NotesRequest request) {
        log.debug("Calling rejectPayment: paymentId={}", paymentId);

        return webClient.post()
                .uri("/api/v1/payments/{paymentId}/reject", paymentId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<PagedResponse<PaymentResponse>> listPendingPayments(Long actorId, ActorRole actorRole,
                                                                              int page, int size) {
        log.debug("Calling listPendingPayments: page={}, size={}", page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/payments/pending")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<PaymentResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> listPropertyPayments(Long actorId, ActorRole actorRole,
                                                                      UUID propertyId) {
        log.debug("Calling listPropertyPayments: propertyId={}", propertyId);

        return webClient.get()
                .uri("/api/v1/payments/properties/{propertyId}", propertyId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<PaymentResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<PaymentResponse>> listTransferPayments(Long actorId, ActorRole actorRole,
                                                                      UUID transferId) {
        log.debug("Calling listTransferPayments: transferId={}", transferId);

        return webClient.get()
                .uri("/api/v1/payments/transfers/{transferId}", transferId)
                .headers(ActorHeaders.of(actorId, actorRole))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<PaymentResponse>>() {})
                .block();
    }
}
