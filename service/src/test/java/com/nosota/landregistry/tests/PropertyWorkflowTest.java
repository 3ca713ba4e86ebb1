package com.nosota.landregistry.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.landregistry.TestBase;
import com.nosota.landregistry.api.dto.PagedResponse;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.api.model.DocumentType;
import com.nosota.landregistry.api.model.ErrorKind;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.api.request.DocumentDecisionRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.ReplaceDocumentRequest;
import com.nosota.landregistry.api.request.SubmitPropertyRequest;
import com.nosota.landregistry.api.request.UpdatePropertyRequest;
import com.nosota.landregistry.api.request.UploadDocumentRequest;
import com.nosota.landregistry.api.response.AuditEntryResponse;
import com.nosota.landregistry.api.response.DocumentResponse;
import com.nosota.landregistry.api.response.ErrorResponse;
import com.nosota.landregistry.api.response.FeeQuoteResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import com.nosota.landregistry.api.response.WorkflowStatusResponse;
import com.nosota.landregistry.service.AggregateStatusProjection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests of the registration workflow through the REST API.
 */
@DisplayName("1. Property registration")
public class PropertyWorkflowTest extends TestBase {

    @Test
    @DisplayName("REG-001: Documents and fee lead to approval")
    void happyPath() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        String plot = "AA-" + UUID.randomUUID().toString().substring(0, 6) + "-000123";

        PropertyResponse submitted = submitProperty(owner, plot, PropertyType.RESIDENTIAL, "250");
        assertThat(submitted.status()).isEqualTo(PropertyStatus.PENDING);
        assertThat(submitted.ownerId()).isEqualTo(owner);
        assertThat(submitted.documentsValidated()).isFalse();

        DocumentResponse deed = uploadDocument(owner, submitted.id(), DocumentType.TITLE_DEED);
        DocumentResponse id = uploadDocument(owner, submitted.id(), DocumentType.ID_CARD);
        DocumentResponse form = uploadDocument(owner, submitted.id(), DocumentType.APPLICATION_FORM);
        verifyDocument(officer, deed.id());
        verifyDocument(officer, id.id());
        verifyDocument(officer, form.id());

        PropertyResponse afterDocuments = getProperty(owner, ActorRole.CITIZEN, submitted.id());
        assertThat(afterDocuments.documentsValidated()).isTrue();
        assertThat(afterDocuments.paymentCompleted()).isFalse();
        assertThat(afterDocuments.status()).isEqualTo(PropertyStatus.DOCUMENTS_VALIDATED);

        FeeQuoteResponse quote = read(mockMvc.perform(as(get("/api/v1/payments/properties/{propertyId}/fee-quote", submitted.id()), owner, ActorRole.CITIZEN))
                .andExpect(status().isOk()), FeeQuoteResponse.class);
        assertThat(quote.amount()).isEqualByComparingTo("7500");
        assertThat(quote.currency()).isEqualTo("ETB");

        PaymentResponse payment = payCompleted(owner, submitted.id(), null, PaymentType.REGISTRATION_FEE, "7500.00");
        assertThat(payment.receiptNumber()).matches("RCP-\\d{8}-[A-Z0-9]{6}");
        verifyPayment(officer, payment.id());

        PropertyResponse ready = getProperty(officer, ActorRole.LAND_OFFICER, submitted.id());
        assertThat(ready.status()).isEqualTo(PropertyStatus.PAYMENT_COMPLETED);
        assertThat(ready.paymentCompleted()).isTrue();

        PropertyResponse approved = read(mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", submitted.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("registered"))))
                .andExpect(status().isOk()), PropertyResponse.class);

        assertThat(approved.status()).isEqualTo(PropertyStatus.APPROVED);
        assertThat(approved.reviewedBy()).isEqualTo(officer);
        assertThat(approved.reviewedAt()).isNotNull();
    }

    @Test
    @DisplayName("REG-002: Plot numbers are unique regardless of case")
    void duplicatePlotNumber() throws Exception {
        String plot = newPlotNumber().toLowerCase();
        submitProperty(newActorId(), plot, PropertyType.RESIDENTIAL, "100");

        ErrorResponse error = read(mockMvc.perform(as(post("/api/v1/properties"), newActorId(), ActorRole.CITIZEN)
                        .content(json(new SubmitPropertyRequest(
                                plot.toUpperCase(), "Kebele 01", "Yeka", null, null,
                                new BigDecimal("80"), PropertyType.COMMERCIAL))))
                .andExpect(status().isConflict()), ErrorResponse.class);

        assertThat(error.kind()).isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    @DisplayName("REG-003: Approval names every missing condition")
    void approvalPrecondition() throws Exception {
        long owner = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "120");

        ErrorResponse error = read(mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), newActorId(), ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isPreconditionFailed()), ErrorResponse.class);

        assertThat(error.kind()).isEqualTo(ErrorKind.PRECONDITION_FAILED);
        assertThat(error.message())
                .contains(AggregateStatusProjection.DOCUMENTS_NOT_VALIDATED)
                .contains(AggregateStatusProjection.PAYMENT_NOT_COMPLETED);

        WorkflowStatusResponse workflow = read(mockMvc.perform(as(get("/api/v1/properties/{propertyId}/workflow", property.id()), owner, ActorRole.CITIZEN))
                .andExpect(status().isOk()), WorkflowStatusResponse.class);
        assertThat(workflow.readyForApproval()).isFalse();
        assertThat(workflow.missingConditions()).hasSize(2);
        assertThat(workflow.nextStep()).isNotBlank();
    }

    @Test
    @DisplayName("REG-004: Officers cannot approve their own application")
    void selfApprovalForbidden() throws Exception {
        long officer = newActorId();
        PropertyResponse property = submitProperty(officer, newPlotNumber(), PropertyType.AGRICULTURAL, "5000");

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), newActorId(), ActorRole.CITIZEN)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("REG-005: Rejection needs a reason and closes the application")
    void rejection() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.INDUSTRIAL, "900");

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReasonRequest("   "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReasonRequest("plot overlaps a road reserve"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.reviewNotes").value("plot overlaps a road reserve"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReasonRequest("again"))))
                .andExpect(status().isConflict());

        mockMvc.perform(as(post("/api/v1/documents/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN)
                        .content(json(new UploadDocumentRequest(
                                DocumentType.TITLE_DEED, "deed.pdf", 1000L, "application/pdf"))))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("REG-006: Rejecting a verified document revokes the validation")
    void documentRevocation() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "300");
        DocumentResponse deed = uploadDocument(owner, property.id(), DocumentType.TITLE_DEED);
        verifyDocument(officer, deed.id());
        verifyDocument(officer, uploadDocument(owner, property.id(), DocumentType.ID_CARD).id());
        verifyDocument(officer, uploadDocument(owner, property.id(), DocumentType.APPLICATION_FORM).id());
        assertThat(getProperty(owner, ActorRole.CITIZEN, property.id()).documentsValidated()).isTrue();

        // decided documents only change on an explicit re-verification
        mockMvc.perform(as(post("/api/v1/documents/{documentId}/reject", deed.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new DocumentDecisionRequest("seal is not legible", false))))
                .andExpect(status().isConflict());

        mockMvc.perform(as(post("/api/v1/documents/{documentId}/reject", deed.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new DocumentDecisionRequest("seal is not legible", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"));

        PropertyResponse revoked = getProperty(owner, ActorRole.CITIZEN, property.id());
        assertThat(revoked.documentsValidated()).isFalse();
        assertThat(revoked.status()).isEqualTo(PropertyStatus.UNDER_REVIEW);

        DocumentResponse replaced = read(mockMvc.perform(as(put("/api/v1/documents/{documentId}/file", deed.id()), owner, ActorRole.CITIZEN)
                        .content(json(new ReplaceDocumentRequest("deed-v2.pdf", 2048L, "application/pdf"))))
                .andExpect(status().isOk()), DocumentResponse.class);
        assertThat(replaced.status()).isEqualTo(DocumentStatus.PENDING);
        assertThat(replaced.fileVersion()).isEqualTo(2);

        verifyDocument(officer, deed.id());
        assertThat(getProperty(owner, ActorRole.CITIZEN, property.id()).documentsValidated()).isTrue();
    }

    @Test
    @DisplayName("REG-007: Rejecting a document requires notes")
    void rejectDocumentWithoutNotes() throws Exception {
        long owner = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "90");
        DocumentResponse form = uploadDocument(owner, property.id(), DocumentType.APPLICATION_FORM);

        mockMvc.perform(as(post("/api/v1/documents/{documentId}/reject", form.id()), newActorId(), ActorRole.LAND_OFFICER)
                        .content(json(new DocumentDecisionRequest(null, false))))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("REG-008: Review starts once, and only from PENDING")
    void startReview() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.COMMERCIAL, "400");

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/review", property.id()), officer, ActorRole.LAND_OFFICER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNDER_REVIEW"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/review", property.id()), officer, ActorRole.LAND_OFFICER))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("INVALID_STATE"));
    }

    @Test
    @DisplayName("REG-009: Unknown ids and missing actor headers")
    void notFoundAndMissingHeaders() throws Exception {
        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", UUID.randomUUID()), newActorId(), ActorRole.ADMIN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mockMvc.perform(get("/api/v1/properties/mine"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("REG-010: Citizens only read their own applications")
    void readAccess() throws Exception {
        long owner = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "150");

        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), newActorId(), ActorRole.CITIZEN))
                .andExpect(status().isForbidden());
        mockMvc.perform(as(get("/api/v1/properties/mine"), owner, ActorRole.CITIZEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(1))
                .andExpect(jsonPath("$.data[0].id").value(property.id().toString()));
        mockMvc.perform(as(get("/api/v1/properties"), owner, ActorRole.CITIZEN))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("REG-011: Owners cannot decide their own application, whatever their role")
    void selfDecisionForbiddenForAnyRole() throws Exception {
        long admin = newActorId();
        PropertyResponse property = submitProperty(admin, newPlotNumber(), PropertyType.RESIDENTIAL, "200");

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), admin, ActorRole.ADMIN)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", property.id()), admin, ActorRole.ADMIN)
                        .content(json(new ReasonRequest("withdrawing my own application"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        long officer = newActorId();
        PropertyResponse officersOwn = submitProperty(officer, newPlotNumber(), PropertyType.COMMERCIAL, "150");
        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", officersOwn.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReasonRequest("incomplete"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        assertThat(getProperty(admin, ActorRole.ADMIN, property.id()).status()).isEqualTo(PropertyStatus.PENDING);
        assertThat(getProperty(officer, ActorRole.LAND_OFFICER, officersOwn.id()).status()).isEqualTo(PropertyStatus.PENDING);
    }

    @Test
    @DisplayName("REG-012: Fee verified before the documents still leads to approval")
    void paymentBeforeDocuments() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "250");
        DocumentResponse deed = uploadDocument(owner, property.id(), DocumentType.TITLE_DEED);
        DocumentResponse id = uploadDocument(owner, property.id(), DocumentType.ID_CARD);
        DocumentResponse form = uploadDocument(owner, property.id(), DocumentType.APPLICATION_FORM);

        PaymentResponse payment = payCompleted(owner, property.id(), null, PaymentType.REGISTRATION_FEE, "7500");
        verifyPayment(officer, payment.id());

        PropertyResponse paidOnly = getProperty(owner, ActorRole.CITIZEN, property.id());
        assertThat(paidOnly.paymentCompleted()).isTrue();
        assertThat(paidOnly.documentsValidated()).isFalse();
        assertThat(paidOnly.status()).isEqualTo(PropertyStatus.UNDER_REVIEW);

        ErrorResponse error = read(mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest(null))))
                .andExpect(status().isPreconditionFailed()), ErrorResponse.class);
        assertThat(error.message())
                .contains(AggregateStatusProjection.DOCUMENTS_NOT_VALIDATED)
                .doesNotContain(AggregateStatusProjection.PAYMENT_NOT_COMPLETED);

        verifyDocument(officer, deed.id());
        verifyDocument(officer, id.id());
        assertThat(getProperty(owner, ActorRole.CITIZEN, property.id()).documentsValidated()).isFalse();
        verifyDocument(officer, form.id());

        PropertyResponse ready = getProperty(owner, ActorRole.CITIZEN, property.id());
        assertThat(ready.documentsValidated()).isTrue();
        assertThat(ready.paymentCompleted()).isTrue();
        assertThat(ready.status()).isEqualTo(PropertyStatus.PAYMENT_COMPLETED);

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("registered"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
    }

    @Test
    @DisplayName("REG-013: Owners edit a pending application, the plot number stays and the fee follows")
    void updatePendingApplication() throws Exception {
        long owner = newActorId();
        String plot = newPlotNumber();
        PropertyResponse property = submitProperty(owner, plot, PropertyType.RESIDENTIAL, "250");

        Map<String, Object> body = Map.of(
                "plotNumber", "ZZ-REPLACED",
                "subCity", "Arada",
                "area", 300,
                "propertyType", "COMMERCIAL");
        PropertyResponse updated = read(mockMvc.perform(as(put("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN)
                        .content(json(body)))
                .andExpect(status().isOk()), PropertyResponse.class);

        assertThat(updated.plotNumber()).isEqualTo(plot);
        assertThat(updated.subCity()).isEqualTo("Arada");
        assertThat(updated.kebele()).isEqualTo("Kebele 07");
        assertThat(updated.area()).isEqualByComparingTo("300");
        assertThat(updated.propertyType()).isEqualTo(PropertyType.COMMERCIAL);
        assertThat(updated.status()).isEqualTo(PropertyStatus.PENDING);

        FeeQuoteResponse quote = read(mockMvc.perform(as(get("/api/v1/payments/properties/{propertyId}/fee-quote", property.id()), owner, ActorRole.CITIZEN))
                .andExpect(status().isOk()), FeeQuoteResponse.class);
        assertThat(quote.amount()).isEqualByComparingTo("15500");

        List<AuditEntryResponse> activity = read(mockMvc.perform(as(get("/api/v1/activity/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN))
                .andExpect(status().isOk()), new TypeReference<List<AuditEntryResponse>>() {});
        AuditEntryResponse update = activity.stream()
                .filter(entry -> "APPLICATION_UPDATED".equals(entry.action()))
                .findFirst().orElseThrow();
        assertThat(update.actorId()).isEqualTo(owner);
        assertThat(update.notes()).contains("15500");
    }

    @Test
    @DisplayName("REG-014: Edits are refused to others, for a non-positive area and once review started")
    void updateRefused() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "250");
        UpdatePropertyRequest larger = new UpdatePropertyRequest(null, null, null, null, new BigDecimal("260"), null);

        mockMvc.perform(as(put("/api/v1/properties/{propertyId}", property.id()), newActorId(), ActorRole.CITIZEN)
                        .content(json(larger)))
                .andExpect(status().isForbidden());

        mockMvc.perform(as(put("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN)
                        .content(json(new UpdatePropertyRequest(null, null, null, null, BigDecimal.ZERO, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/review", property.id()), officer, ActorRole.LAND_OFFICER))
                .andExpect(status().isOk());
        mockMvc.perform(as(put("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN)
                        .content(json(larger)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONFLICT"));

        mockMvc.perform(as(post("/api/v1/properties/{propertyId}/reject", property.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ReasonRequest("survey mismatch"))))
                .andExpect(status().isOk());
        mockMvc.perform(as(put("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN)
                        .content(json(larger)))
                .andExpect(status().isConflict());

        assertThat(getProperty(owner, ActorRole.CITIZEN, property.id()).area()).isEqualByComparingTo("250");
    }

    @Test
    @DisplayName("REG-015: Uploaded documents wait in the officer queue until decided")
    void pendingDocumentQueue() throws Exception {
        long owner = newActorId();
        long officer = newActorId();
        PropertyResponse property = submitProperty(owner, newPlotNumber(), PropertyType.RESIDENTIAL, "110");
        DocumentResponse deed = uploadDocument(owner, property.id(), DocumentType.TITLE_DEED);

        assertThat(pendingDocumentIds(officer)).contains(deed.id());

        verifyDocument(officer, deed.id());
        assertThat(pendingDocumentIds(officer)).doesNotContain(deed.id());

        mockMvc.perform(as(get("/api/v1/documents/pending"), owner, ActorRole.CITIZEN))
                .andExpect(status().isForbidden());
    }

    private List<UUID> pendingDocumentIds(long officer) throws Exception {
        PagedResponse<DocumentResponse> queue = read(mockMvc.perform(as(get("/api/v1/documents/pending"), officer, ActorRole.LAND_OFFICER)
                        .param("size", "500"))
                .andExpect(status().isOk()), new TypeReference<PagedResponse<DocumentResponse>>() {});
        return queue.getData().stream().map(DocumentResponse::id).toList();
    }

    private PropertyResponse getProperty(long actorId, ActorRole role, UUID propertyId) throws Exception {
        return read(mockMvc.perform(as(get("/api/v1/properties/{propertyId}", propertyId), actorId, role))
                .andExpect(status().isOk()), PropertyResponse.class);
    }
}
