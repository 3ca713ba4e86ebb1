package com.nosota.landregistry.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.landregistry.TestBase;
import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.PaymentMethod;
import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.api.request.InitiatePaymentRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.PaymentStatusUpdateRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.response.PaymentResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests of payment recording and verification.
 */
@DisplayName("4. Payments")
public class PaymentWorkflowTest extends TestBase {

    @Test
    @DisplayName("PAY-001: Zero and negative amounts are refused")
    void invalidAmount() throws Exception {
        long owner = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "100");

        for (String amount : new String[]{"0", "-10"}) {
            mockMvc.perform(as(post("/api/v1/payments"), owner, ActorRole.CITIZEN)
                            .content(json(request(property, amount))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_AMOUNT"));
        }
    }

    @Test
    @DisplayName("PAY-002: A wrong amount cannot be verified")
    void amountMismatch() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "100");
        PaymentResponse payment = payCompleted(owner, property.id(), null, PaymentType.REGISTRATION_FEE, "4499.99");

        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/verify", payment.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/reject", payment.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isBadRequest());

        PaymentResponse rejected = read(mockMvc.perform(as(post("/api/v1/payments/{paymentId}/reject", payment.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("short by 0.01 ETB"))))
                .andExpect(status().isOk()), PaymentResponse.class);
        assertThat(rejected.verificationStatus()).isEqualTo(PaymentVerificationStatus.REJECTED);
    }

    @Test
    @DisplayName("PAY-003: Only completed payments are verified, and only once")
    void verificationStates() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.COMMERCIAL, "100");

        PaymentResponse pending = read(mockMvc.perform(as(post("/api/v1/payments"), owner, ActorRole.CITIZEN)
                        .content(json(request(property, "8500"))))
                .andExpect(status().isCreated()), PaymentResponse.class);
        assertThat(pending.status()).isEqualTo(PaymentStatus.PENDING);

        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/verify", pending.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isUnprocessableEntity());

        String transactionId = "TX-" + pending.id();
        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/status", pending.id()), owner, ActorRole.CITIZEN)
                        .content(json(new PaymentStatusUpdateRequest(PaymentStatus.COMPLETED, transactionId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.receiptNumber").isNotEmpty());

        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/status", pending.id()), owner, ActorRole.CITIZEN)
                        .content(json(new PaymentStatusUpdateRequest(PaymentStatus.FAILED, null))))
                .andExpect(status().isConflict());

        verifyPayment(officer, pending.id());
        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/verify", pending.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isConflict());

        mockMvc.perform(as(post("/api/v1/payments"), owner, ActorRole.CITIZEN)
                        .content(json(request(property, "8500"))))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("PAY-004: A transfer fee cannot be paid against an application")
    void scopeMismatch() throws Exception {
        long owner = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "100");

        mockMvc.perform(as(post("/api/v1/payments"), owner, ActorRole.CITIZEN)
                        .content(json(new InitiatePaymentRequest(property.id(), null, new BigDecimal("300"), "ETB",
                                PaymentType.TRANSFER_FEE, PaymentMethod.CBE_BIRR, Map.of("account", "1000123456789")))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("PAY-005: Payments of a closed application are no longer decided")
    void closedApplication() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "250");
        PaymentResponse payment = payCompleted(owner, property.id(), null, PaymentType.REGISTRATION_FEE, "7500");

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReasonRequest("plot is state land"))))
                .andExpect(status().isOk());

        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/verify", payment.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("amount matches"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONFLICT"));

        mockMvc.perform(as(post("/api/v1/payments/{paymentId}/reject", payment.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("application closed"))))
                .andExpect(status().isConflict());

        mockMvc.perform(as(get("/api/v1/payments/{paymentId}", payment.id()), officer, ActorRole.LAND_OFFICER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verificationStatus").value("UNSET"));
        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN))
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.paymentCompleted").value(false));
    }

    @Test
    @DisplayName("PAY-006: Completed payments wait in the verification queue until decided")
    void verificationQueue() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "250");
        PaymentResponse payment = payCompleted(owner, property.id(), null, PaymentType.REGISTRATION_FEE, "7500");

        assertThat(pendingPaymentIds(officer)).contains(payment.id().toString());

        verifyPayment(officer, payment.id());
        assertThat(pendingPaymentIds(officer)).doesNotContain(payment.id().toString());

        mockMvc.perform(as(get("/api/v1/payments/pending"), owner, ActorRole.CITIZEN))
                .andExpect(status().isForbidden());
    }

    private List<String> pendingPaymentIds(long officer) throws Exception {
        PagedResponse<PaymentResponse> queue = read(mockMvc.perform(as(get("/api/v1/payments/pending"), officer, ActorRole.LAND_OFFICER)
                        .param("size", "500"))
                .andExpect(status().isOk()), new TypeReference<PagedResponse<PaymentResponse>>() {});
        return queue.getData().stream().map(queued -> queued.id().toString()).toList();
    }

    private static InitiatePaymentRequest request(PropertyResponse property, String amount) {
        return new InitiatePaymentRequest(property.id(), null, new BigDecimal(amount), "ETB",
                PaymentType.REGISTRATION_FEE, PaymentMethod.TELEBIRR, Map.of("phone", "+251911000000"));
    }
}
