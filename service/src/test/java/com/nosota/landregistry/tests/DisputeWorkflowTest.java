package com.nosota.landregistry.tests;

import com.nosota.landregistry.TestBase;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.DisputeDecision;
import com.nosota.landregistry.api.model.DisputePriority;
import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.api.model.DisputeType;
import com.nosota.landregistry.api.model.TransferType;
import com.nosota.landregistry.api.request.AssignDisputeRequest;
import com.nosota.landregistry.api.request.DisputeStatusUpdateRequest;
import com.nosota.landregistry.api.request.FileDisputeRequest;
import com.nosota.landregistry.api.request.InitiateTransferRequest;
import com.nosota.landregistry.api.request.ReasonRequest;
import com.nosota.landregistry.api.request.ResolveDisputeRequest;
import com.nosota.landregistry.api.response.DisputeResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests of the dispute workflow and its effect on transfers.
 */
@DisplayName("3. Disputes")
public class DisputeWorkflowTest extends TestBase {

    @Test
    @DisplayName("DSP-001: A dispute blocks transfers until it is resolved")
    void disputeBlocksTransfer() throws Exception {
        long owner = newActorId();
        long neighbour = newActorId();
        long officer = newActorId();
        long admin = newActorId();
        PropertyResponse property = registerApprovedProperty(owner, officer);

        DisputeResponse dispute = file(property.id(), neighbour, DisputeType.BOUNDARY_DISPUTE);
        assertThat(dispute.status()).isEqualTo(DisputeStatus.SUBMITTED);
        assertThat(dispute.priority()).isEqualTo(DisputePriority.LOW);
        assertThat(dispute.timeline()).hasSize(1);

        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN))
                .andExpect(jsonPath("$.hasActiveDispute").value(true));

        mockMvc.perform(as(post("/api/v1/transfers"), owner, ActorRole.CITIZEN)
                        .content(json(transferTo(property.id(), newActorId()))))
                .andExpect(status().isPreconditionFailed());

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/assign", dispute.id()), admin, ActorRole.ADMIN)
                        .content(json(new AssignDisputeRequest(officer, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedTo").value(officer));

        updateStatus(dispute.id(), officer, DisputeStatus.UNDER_REVIEW, "reviewing survey maps");
        updateStatus(dispute.id(), officer, DisputeStatus.INVESTIGATION, "site visit scheduled");

        DisputeResponse resolved = read(mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/resolve", dispute.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ResolveDisputeRequest(DisputeDecision.COMPROMISE,
                                "boundary moved by 1.5 m", "re-survey the eastern edge"))))
                .andExpect(status().isOk()), DisputeResponse.class);

        assertThat(resolved.status()).isEqualTo(DisputeStatus.RESOLVED);
        assertThat(resolved.resolvedBy()).isEqualTo(officer);
        assertThat(resolved.timeline()).extracting("action")
                .containsExactly("DISPUTE_FILED", "DISPUTE_ASSIGNED", "DISPUTE_STATUS_UPDATED",
                        "DISPUTE_STATUS_UPDATED", "DISPUTE_RESOLVED");

        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), owner, ActorRole.CITIZEN))
                .andExpect(jsonPath("$.hasActiveDispute").value(false));

        mockMvc.perform(as(post("/api/v1/transfers"), owner, ActorRole.CITIZEN)
                        .content(json(transferTo(property.id(), newActorId()))))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("DSP-002: Status updates follow the dispute state machine")
    void illegalStatusUpdate() throws Exception {
        long officer = newActorId();
        PropertyResponse property = registerApprovedProperty(newActorId(), officer);
        DisputeResponse dispute = file(property.id(), newActorId(), DisputeType.DOCUMENTATION_ERROR);

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/status", dispute.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new DisputeStatusUpdateRequest(DisputeStatus.MEDIATION, "skip ahead"))))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/status", dispute.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new DisputeStatusUpdateRequest(DisputeStatus.UNDER_REVIEW, null))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/resolve", dispute.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new ResolveDisputeRequest(null, "no decision", null))))
                .andExpect(status().isBadRequest());

        updateStatus(dispute.id(), officer, DisputeStatus.DISMISSED, "filed against the wrong plot");

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/status", dispute.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new DisputeStatusUpdateRequest(DisputeStatus.UNDER_REVIEW, "reopen"))))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("DSP-003: One active dispute per disputant and property, withdrawn by the disputant only")
    void duplicateAndWithdraw() throws Exception {
        long disputant = newActorId();
        PropertyResponse property = registerApprovedProperty(newActorId(), newActorId());
        DisputeResponse dispute = file(property.id(), disputant, DisputeType.FRAUDULENT_REGISTRATION);
        assertThat(dispute.priority()).isEqualTo(DisputePriority.HIGH);

        mockMvc.perform(as(post("/api/v1/disputes"), disputant, ActorRole.CITIZEN)
                        .content(json(disputeRequest(property.id(), DisputeType.BOUNDARY_DISPUTE))))
                .andExpect(status().isConflict());

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/withdraw", dispute.id()), newActorId(), ActorRole.CITIZEN)
                        .content(json(new ReasonRequest("not mine"))))
                .andExpect(status().isForbidden());

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/withdraw", dispute.id()), disputant, ActorRole.CITIZEN)
                        .content(json(new ReasonRequest("settled privately"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("WITHDRAWN"));

        mockMvc.perform(as(get("/api/v1/properties/{propertyId}", property.id()), newActorId(), ActorRole.ADMIN))
                .andExpect(jsonPath("$.hasActiveDispute").value(false));

        mockMvc.perform(as(get("/api/v1/disputes/mine"), disputant, ActorRole.CITIZEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(1));
    }

    @Test
    @DisplayName("DSP-004: Only citizens file disputes")
    void officersDoNotFile() throws Exception {
        PropertyResponse property = registerApprovedProperty(newActorId(), newActorId());

        mockMvc.perform(as(post("/api/v1/disputes"), newActorId(), ActorRole.LAND_OFFICER)
                        .content(json(disputeRequest(property.id(), DisputeType.BOUNDARY_DISPUTE))))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("DSP-005: Only admins assign disputes")
    void assignIsAdminOnly() throws Exception {
        long officer = newActorId();
        PropertyResponse property = registerApprovedProperty(newActorId(), officer);
        DisputeResponse dispute = file(property.id(), newActorId(), DisputeType.BOUNDARY_DISPUTE);

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/assign", dispute.id()), officer, ActorRole.LAND_OFFICER)
                        .content(json(new AssignDisputeRequest(officer, "taking this one"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/assign", dispute.id()), newActorId(), ActorRole.CITIZEN)
                        .content(json(new AssignDisputeRequest(officer, null))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        mockMvc.perform(as(get("/api/v1/disputes/{disputeId}", dispute.id()), officer, ActorRole.LAND_OFFICER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedTo").doesNotExist());
    }

    private DisputeResponse file(UUID propertyId, long disputant, DisputeType type) throws Exception {
        return read(mockMvc.perform(as(post("/api/v1/disputes"), disputant, ActorRole.CITIZEN)
                        .content(json(disputeRequest(propertyId, type))))
                .andExpect(status().isCreated()), DisputeResponse.class);
    }

    private void updateStatus(UUID disputeId, long officer, DisputeStatus target, String notes) throws Exception {
        mockMvc.perform(as(post("/api/v1/disputes/{disputeId}/status", disputeId), officer, ActorRole.LAND_OFFICER)
                        .content(json(new DisputeStatusUpdateRequest(target, notes))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(target.name()));
    }

    private static FileDisputeRequest disputeRequest(UUID propertyId, DisputeType type) {
        return new FileDisputeRequest(propertyId, type, "Fence crosses the boundary",
                "The eastern fence stands two metres inside the neighbouring plot.");
    }

    private static InitiateTransferRequest transferTo(UUID propertyId, long newOwner) {
        return new InitiateTransferRequest(propertyId, TransferType.GIFT, newOwner,
                BigDecimal.ZERO, "ETB", "gift to a relative");
    }
}
