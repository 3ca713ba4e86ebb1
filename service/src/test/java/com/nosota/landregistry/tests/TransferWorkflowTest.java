package com.nosota.landregistry.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.landregistry.TestBase;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.ComplianceOutcome;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.api.model.RiskLevel;
import com.nosota.landregistry.api.model.TransferDocumentStatus;
import com.nosota.landregistry.api.model.TransferDocumentType;
import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.api.model.TransferType;
import com.nosota.landregistry.api.request.ComplianceCheckRequest;
import com.nosota.landregistry.api.request.InitiateTransferRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.ReviewTransferDocumentsRequest;
import com.nosota.landregistry.api.request.SubmitTransferDocumentsRequest;
import com.nosota.landregistry.api.request.TransferDocumentDecision;
import com.nosota.landregistry.api.request.TransferDocumentSubmission;
import com.nosota.landregistry.api.response.FeeQuoteResponse;
import com.nosota.landregistry.api.response.OwnershipRecordResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import com.nosota.landregistry.api.response.TransferResponse;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.security.Actor;
import com.nosota.landregistry.service.TransferService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.containsString;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests of the ownership transfer workflow.
 */
@DisplayName("2. Ownership transfer")
public class TransferWorkflowTest extends TestBase {

    @Autowired
    private TransferService transferService;

    @Test
    @DisplayName("TRF-001: Sale from initiation to completion reassigns the owner")
    void saleCompletes() throws Exception {
        long seller = newActorId();
        long buyer = newActorId();
        long officer = newActorId();
        long admin = newActorId();
        PropertyResponse property = registerApprovedProperty(seller, officer);

        TransferResponse approved = approvedSale(property.id(), seller, buyer, officer);
        assertThat(approved.status()).isEqualTo(TransferStatus.APPROVED);

        TransferResponse completed = read(mockMvc.perform(as(post("/api/v1/transfers/{transferId}/complete", approved.id()), admin, ActorRole.ADMIN))
                .andExpect(status().isOk()), TransferResponse.class);
        assertThat(completed.status()).isEqualTo(TransferStatus.COMPLETED);
        assertThat(completed.completionDate()).isNotNull();

        PropertyResponse transferred = read(mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), buyer, ActorRole.CITIZEN))
                .andExpect(status().isOk()), PropertyResponse.class);
        assertThat(transferred.ownerId()).isEqualTo(buyer);
        assertThat(transferred.currentTransferId()).isNull();

        List<OwnershipRecordResponse> history = read(mockMvc.perform(as(get("/api/v1/properties/{propertyId}/ownership-history", property.id()), buyer, ActorRole.CITIZEN))
                .andExpect(status().isOk()), new TypeReference<List<OwnershipRecordResponse>>() {});
        assertThat(history).hasSize(1);
        assertThat(history.get(0).ownerId()).isEqualTo(seller);
        assertThat(history.get(0).acquisitionType()).isEqualTo(TransferType.SALE);
        assertThat(history.get(0).transferId()).isEqualTo(approved.id());
        assertThat(history.get(0).endDate()).isNotNull();

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/complete", approved.id()), admin, ActorRole.ADMIN))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("TRF-002: Only approved properties without an open transfer can be transferred")
    void initiationPreconditions() throws Exception {
        long owner = newActorId();
        PropertyResponse pending = submitProperty(owner, newPlotNumber(),
                PropertyType.RESIDENTIAL, "100");

        mockMvc.perform(as(post("/api/v1/transfers"), owner, ActorRole.CITIZEN)
                        .content(json(saleRequest(pending.id(), newActorId()))))
                .andExpect(status().isPreconditionFailed());

        PropertyResponse approved = registerApprovedProperty(owner, newActorId());
        mockMvc.perform(as(post("/api/v1/transfers"), owner, ActorRole.CITIZEN)
                        .content(json(saleRequest(approved.id(), owner))))
                .andExpect(status().isBadRequest());

        initiate(approved.id(), owner, newActorId());
        mockMvc.perform(as(post("/api/v1/transfers"), owner, ActorRole.CITIZEN)
                        .content(json(saleRequest(approved.id(), newActorId()))))
                .andExpect(status().isConflict());

        mockMvc.perform(as(post("/api/v1/transfers"), newActorId(), ActorRole.CITIZEN)
                        .content(json(saleRequest(approved.id(), newActorId()))))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("TRF-003: Approval needs passed checks and a paid fee, and not by a party")
    void approvalPreconditions() throws Exception {
        long seller = newActorId();
        long buyer = newActorId();
        long officer = newActorId();
        PropertyResponse property = registerApprovedProperty(seller, officer);
        TransferResponse transfer = initiate(property.id(), seller, buyer);

        submitAndVerifyDocuments(transfer.id(), seller, buyer, officer);
        TransferResponse checked = read(mockMvc.perform(as(post("/api/v1/transfers/{transferId}/compliance", transfer.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ComplianceCheckRequest(ComplianceOutcome.PASSED, ComplianceOutcome.FAILED,
                                ComplianceOutcome.PASSED, RiskLevel.LOW, "tax arrears found"))))
                .andExpect(status().isOk()), TransferResponse.class);
        assertThat(checked.status()).isEqualTo(TransferStatus.COMPLIANCE_CHECK);

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/approve", transfer.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.message").value(containsString("compliance checks not all passed")))
                .andExpect(jsonPath("$.message").value(containsString("transfer fee not yet paid")));

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/approve", transfer.id()), buyer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("TRF-004: A rejected transfer document sends the transfer back")
    void rejectedDocumentSendsBack() throws Exception {
        long seller = newActorId();
        long buyer = newActorId();
        long officer = newActorId();
        PropertyResponse property = registerApprovedProperty(seller, officer);
        TransferResponse transfer = initiate(property.id(), seller, buyer);

        TransferResponse submitted = submitDocuments(transfer.id(), seller,
                TransferDocumentType.ID_DOCUMENTS, TransferDocumentType.SALE_AGREEMENT);
        UUID agreement = submitted.documents().stream()
                .filter(document -> document.documentType() == TransferDocumentType.SALE_AGREEMENT)
                .findFirst().orElseThrow().id();

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/documents/review", transfer.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReviewTransferDocumentsRequest(List.of(
                                new TransferDocumentDecision(agreement, TransferDocumentStatus.REJECTED, null))))))
                .andExpect(status().isBadRequest());

        TransferResponse reviewed = read(mockMvc.perform(as(post("/api/v1/transfers/{transferId}/documents/review", transfer.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReviewTransferDocumentsRequest(List.of(
                                new TransferDocumentDecision(agreement, TransferDocumentStatus.REJECTED, "unsigned"))))))
                .andExpect(status().isOk()), TransferResponse.class);

        assertThat(reviewed.status()).isEqualTo(TransferStatus.DOCUMENTS_PENDING);
    }

    @Test
    @DisplayName("TRF-005: Cancelling needs a reason and releases the property")
    void cancellation() throws Exception {
        long seller = newActorId();
        long officer = newActorId();
        PropertyResponse property = registerApprovedProperty(seller, officer);
        TransferResponse transfer = initiate(property.id(), seller, newActorId());

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/cancel", transfer.id()), seller, ActorRole.CITIZEN)
                        .content(json(new ReasonRequest(""))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/cancel", transfer.id()), seller, ActorRole.CITIZEN)
                        .content(json(new ReasonRequest("buyer withdrew"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), seller, ActorRole.CITIZEN))
                .andExpect(jsonPath("$.currentTransferId").doesNotExist());

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/complete", transfer.id()), newActorId(), ActorRole.ADMIN))
                .andExpect(status().isUnprocessableEntity());

        // the property is free for a new transfer
        initiate(property.id(), seller, newActorId());
    }

    @Test
    @DisplayName("TRF-006: Concurrent completions apply exactly once")
    void concurrentCompletion() throws Exception {
        long seller = newActorId();
        long buyer = newActorId();
        long officer = newActorId();
        PropertyResponse property = registerApprovedProperty(seller, officer);
        TransferResponse approved = approvedSale(property.id(), seller, buyer, officer);

        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransferStatus>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Actor admin = Actor.of(newActorId(), ActorRole.ADMIN);
                Callable<TransferStatus> complete = () -> {
                    start.await();
                    return transferService.completeTransfer(admin, approved.id()).getStatus();
                };
                results.add(executor.submit(complete));
            }
            start.countDown();

            int completed = 0;
            int conflicts = 0;
            for (Future<TransferStatus> result : results) {
                try {
                    assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(TransferStatus.COMPLETED);
                    completed++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConflictException.class);
                    conflicts++;
                }
            }
            assertThat(completed).isEqualTo(1);
            assertThat(conflicts).isEqualTo(threads - 1);
        } finally {
            executor.shutdownNow();
        }

        List<OwnershipRecordResponse> history = read(mockMvc.perform(as(get("/api/v1/properties/{propertyId}/ownership-history", property.id()), buyer, ActorRole.CITIZEN))
                .andExpect(status().isOk()), new TypeReference<List<OwnershipRecordResponse>>() {});
        assertThat(history).hasSize(1);
    }

    private TransferResponse approvedSale(UUID propertyId, long seller, long buyer, long officer) throws Exception {
        TransferResponse transfer = initiate(propertyId, seller, buyer);

        FeeQuoteResponse quote = read(mockMvc.perform(as(get("/api/v1/payments/transfers/{transferId}/fee-quote", transfer.id()), seller, ActorRole.CITIZEN))
                .andExpect(status().isOk()), FeeQuoteResponse.class);
        assertThat(quote.amount()).isEqualByComparingTo("35300");

        PaymentResponse fee = payCompleted(seller, null, transfer.id(), PaymentType.TRANSFER_FEE, "35300");
        verifyPayment(officer, fee.id());

        TransferResponse paid = read(mockMvc.perform(as(get("/api/v1/transfers/{transferId}", transfer.id()), buyer, ActorRole.CITIZEN))
                .andExpect(status().isOk()), TransferResponse.class);
        assertThat(paid.feePaid()).isTrue();
        assertThat(paid.status()).isEqualTo(TransferStatus.DOCUMENTS_PENDING);

        TransferResponse reviewed = submitAndVerifyDocuments(transfer.id(), seller, buyer, officer);
        assertThat(reviewed.status()).isEqualTo(TransferStatus.UNDER_REVIEW);

        mockMvc.perform(as(post("/api/v1/transfers/{transferId}/compliance", transfer.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ComplianceCheckRequest(ComplianceOutcome.PASSED, ComplianceOutcome.PASSED,
                                ComplianceOutcome.PASSED, RiskLevel.LOW, null))))
                .andExpect(status().isOk());

        return read(mockMvc.perform(as(post("/api/v1/transfers/{transferId}/approve", transfer.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("sale approved"))))
                .andExpect(status().isOk()), TransferResponse.class);
    }

    private TransferResponse submitAndVerifyDocuments(UUID transferId, long seller, long buyer, long officer) throws Exception {
        submitDocuments(transferId, seller, TransferDocumentType.ID_DOCUMENTS, TransferDocumentType.SALE_AGREEMENT);
        TransferResponse submitted = submitDocuments(transferId, buyer, TransferDocumentType.ID_DOCUMENTS);
        assertThat(submitted.status()).isEqualTo(TransferStatus.DOCUMENTS_SUBMITTED);

        List<TransferDocumentDecision> decisions = submitted.documents().stream()
                .map(document -> new TransferDocumentDecision(document.id(), TransferDocumentStatus.VERIFIED, null))
                .toList();

        return read(mockMvc.perform(as(post("/api/v1/transfers/{transferId}/documents/review", transferId), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReviewTransferDocumentsRequest(decisions))))
                .andExpect(status().isOk()), TransferResponse.class);
    }

    private TransferResponse submitDocuments(UUID transferId, long party, TransferDocumentType... types) throws Exception {
        List<TransferDocumentSubmission> documents = new ArrayList<>();
        for (TransferDocumentType type : types) {
            documents.add(new TransferDocumentSubmission(type, type.name().toLowerCase() + ".pdf", 4096L, "application/pdf"));
        }
        return read(mockMvc.perform(as(post("/api/v1/transfers/{transferId}/documents", transferId), party, ActorRole.CITIZEN)
                        .content(json(new SubmitTransferDocumentsRequest(documents))))
                .andExpect(status().isOk()), TransferResponse.class);
    }

    private TransferResponse initiate(UUID propertyId, long seller, long buyer) throws Exception {
        TransferResponse transfer = read(mockMvc.perform(as(post("/api/v1/transfers"), seller, ActorRole.CITIZEN)
                        .content(json(saleRequest(propertyId, buyer))))
                .andExpect(status().isCreated()), TransferResponse.class);
        assertThat(transfer.status()).isEqualTo(TransferStatus.INITIATED);
        assertThat(transfer.previousOwnerId()).isEqualTo(seller);
        return transfer;
    }

    private static InitiateTransferRequest saleRequest(UUID propertyId, long buyer) {
        return new InitiateTransferRequest(propertyId, TransferType.SALE, buyer,
                new BigDecimal("1000000"), "ETB", "sale agreed between the parties");
    }
}
