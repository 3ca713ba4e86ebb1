package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.model.DisputePriority;
import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.api.request.FileDisputeRequest;
import com.nosota.landregistry.api.request.ResolveDisputeRequest;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.NotFoundException;
import com.nosota.landregistry.error.WorkflowValidationException;
import com.nosota.landregistry.event.WorkflowEventPublisher;
import com.nosota.landregistry.model.Dispute;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.model.TimelineEntry;
import com.nosota.landregistry.repository.DisputeRepository;
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

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Dispute resolution workflow.
 *
 * <p>Status lifecycle:
 * <pre>
 * SUBMITTED → UNDER_REVIEW → INVESTIGATION ⇄ MEDIATION
 * RESOLVED (resolve), DISMISSED (status update), WITHDRAWN (disputant) end the dispute.
 * </pre>
 *
 * <p>The dispute row is locked first and the property row second. Whenever a dispute leaves the
 * active set, the property's {@code hasActiveDispute} flag is recomputed from the remaining
 * disputes.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DisputeService {

    private final DisputeRepository disputeRepository;
    private final PropertyApplicationService propertyApplicationService;
    private final DisputeStatusStateMachine disputeStatusStateMachine;
    private final DisputePriorityPolicy disputePriorityPolicy;
    private final WorkflowEventPublisher workflowEventPublisher;
    private final Clock clock;

    /**
     * Files a dispute against a property. Citizens only.
     *
     * @throws ConflictException if the caller already has an active dispute on the property
     */
    @Transactional
    public Dispute fileDispute(@NotNull Actor actor, @NotNull FileDisputeRequest request) {
        AccessGuard.CITIZEN.check(actor);
        PropertyApplication property = propertyApplicationService.lockApplication(request.propertyId());

        if (disputeRepository.existsByPropertyIdAndDisputantIdAndStatusIn(
                property.getId(), actor.id(), DisputeStatusStateMachine.ACTIVE_STATUSES)) {
            throw new ConflictException("You already have an active dispute on property " + property.getId());
        }

        LocalDateTime now = LocalDateTime.now(clock);

        Dispute dispute = new Dispute();
        dispute.setPropertyId(property.getId());
        dispute.setDisputantId(actor.id());
        dispute.setDisputeType(request.disputeType());
        dispute.setTitle(request.title().trim());
        dispute.setDescription(request.description().trim());
        dispute.setStatus(DisputeStatus.SUBMITTED);
        dispute.setCreatedAt(now);
        dispute.setUpdatedAt(now);
        appendTimeline(dispute, "DISPUTE_FILED", dispute.getTitle(), actor, now);
        dispute = disputeRepository.save(dispute);

        property.setHasActiveDispute(true);
        property.setUpdatedAt(now);

        log.info("Dispute {} ({}) filed on property {} by {}", dispute.getId(), dispute.getDisputeType(),
                property.getId(), actor);
        publish(dispute, "DISPUTE_FILED", null, DisputeStatus.SUBMITTED, actor, dispute.getTitle());
        return dispute;
    }

    /**
     * Moves a dispute along the officer-driven edges.
     *
     * @throws WorkflowValidationException if notes are missing
     * @throws ConflictException           if the dispute is already closed
     * @throws com.nosota.landregistry.error.InvalidStateException if the edge is illegal
     */
    @Transactional
    public Dispute updateStatus(@NotNull Actor actor, @NotNull UUID disputeId,
                                @NotNull DisputeStatus status, String notes) {
        Dispute dispute = lockDispute(disputeId);
        AccessGuard.STAFF.check(actor);
        requireText(notes, "Notes are required when changing the status of a dispute");

        DisputeStatus fromStatus = dispute.getStatus();
        disputeStatusStateMachine.validateStatusUpdate(fromStatus, status);

        return transition(actor, dispute, status, notes.trim(), "DISPUTE_STATUS_UPDATED");
    }

    /**
     * Assigns a dispute to an officer. Admins only.
     */
    @Transactional
    public Dispute assignDispute(@NotNull Actor actor, @NotNull UUID disputeId, @NotNull Long officerId, String notes) {
        Dispute dispute = lockDispute(disputeId);
        AccessGuard.ADMIN.check(actor);
        disputeStatusStateMachine.requireNotFinal(dispute.getStatus());

        LocalDateTime now = LocalDateTime.now(clock);
        dispute.setAssignedTo(officerId);
        dispute.setAssignedAt(now);
        dispute.setUpdatedAt(now);
        String entryNotes = notes != null && !notes.isBlank() ? notes.trim() : "assigned to officer " + officerId;
        appendTimeline(dispute, "DISPUTE_ASSIGNED", entryNotes, actor, now);

        log.info("Dispute {} assigned to officer {} by {}", disputeId, officerId, actor);
        publish(dispute, "DISPUTE_ASSIGNED", dispute.getStatus(), dispute.getStatus(), actor, entryNotes);
        return dispute;
    }

    /**
     * Resolves a dispute from any non-final state, recording the decision and the resolver.
     *
     * @throws WorkflowValidationException if the decision or resolution notes are missing
     */
    @Transactional
    public Dispute resolveDispute(@NotNull Actor actor, @NotNull UUID disputeId, @NotNull ResolveDisputeRequest request) {
        Dispute dispute = lockDispute(disputeId);
        AccessGuard.STAFF.check(actor);

        if (request.decision() == null) {
            throw new WorkflowValidationException("A decision is required to resolve a dispute");
        }
        requireText(request.resolutionNotes(), "Resolution notes are required to resolve a dispute");
        disputeStatusStateMachine.requireNotFinal(dispute.getStatus());

        LocalDateTime now = LocalDateTime.now(clock);
        dispute.setDecision(request.decision());
        dispute.setResolutionNotes(request.resolutionNotes().trim());
        dispute.setActionRequired(request.actionRequired());
        dispute.setResolvedBy(actor.id());
        dispute.setResolutionDate(now);

        return transition(actor, dispute, DisputeStatus.RESOLVED,
                request.decision() + ": " + request.resolutionNotes().trim(), "DISPUTE_RESOLVED");
    }

    /**
     * Withdraws a dispute. Only the disputant, from any non-final state.
     */
    @Transactional
    public Dispute withdrawDispute(@NotNull Actor actor, @NotNull UUID disputeId, String reason) {
        Dispute dispute = lockDispute(disputeId);
        AccessGuard.owner(dispute.getDisputantId()).check(actor);
        disputeStatusStateMachine.requireNotFinal(dispute.getStatus());

        String notes = reason != null && !reason.isBlank() ? reason.trim() : null;
        return transition(actor, dispute, DisputeStatus.WITHDRAWN, notes, "DISPUTE_WITHDRAWN");
    }

    public Dispute getDispute(@NotNull Actor actor, @NotNull UUID disputeId) {
        Dispute dispute = disputeRepository.findById(disputeId)
                .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));
        AccessGuard.ownerOrAnyOf(dispute.getDisputantId(), ActorRole.LAND_OFFICER, ActorRole.ADMIN).check(actor);
        return dispute;
    }

    public Page<Dispute> listDisputes(@NotNull Actor actor, DisputeStatus status, int page, int size) {
        AccessGuard.STAFF.check(actor);
        PageRequest pageable = PageRequest.of(page, size);
        return status != null
                ? disputeRepository.findByStatusOrderByCreatedAtDesc(status, pageable)
                : disputeRepository.findAllByOrderByCreatedAtDesc(pageable);
    }

    public Page<Dispute> listMyDisputes(@NotNull Actor actor, int page, int size) {
        return disputeRepository.findByDisputantIdOrderByCreatedAtDesc(actor.id(), PageRequest.of(page, size));
    }

    /**
     * Priority as of now. Never stored.
     */
    public DisputePriority priorityOf(Dispute dispute) {
        return disputePriorityPolicy.priorityOf(dispute.getDisputeType(), dispute.getCreatedAt(), LocalDateTime.now(clock));
    }

    private Dispute transition(Actor actor, Dispute dispute, DisputeStatus toStatus, String notes, String action) {
        DisputeStatus fromStatus = dispute.getStatus();
        LocalDateTime now = LocalDateTime.now(clock);

        dispute.setStatus(toStatus);
        dispute.setUpdatedAt(now);
        appendTimeline(dispute, action, notes, actor, now);

        if (DisputeStatusStateMachine.ACTIVE_STATUSES.contains(fromStatus)
                && !DisputeStatusStateMachine.ACTIVE_STATUSES.contains(toStatus)) {
            // flush the new status so the exists query below no longer sees this dispute as active
            disputeRepository.saveAndFlush(dispute);
            PropertyApplication property = propertyApplicationService.lockApplication(dispute.getPropertyId());
            boolean stillActive = disputeRepository.existsByPropertyIdAndStatusIn(
                    property.getId(), DisputeStatusStateMachine.ACTIVE_STATUSES);
            if (property.isHasActiveDispute() != stillActive) {
                property.setHasActiveDispute(stillActive);
                property.setUpdatedAt(now);
            }
        }

        log.info("Dispute {}: {} → {} by {}", dispute.getId(), fromStatus, toStatus, actor);
        publish(dispute, action, fromStatus, toStatus, actor, notes);
        return dispute;
    }

    private Dispute lockDispute(UUID disputeId) {
        return disputeRepository.getOneForUpdate(disputeId)
                .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new WorkflowValidationException(message);
        }
    }

    private static void appendTimeline(Dispute dispute, String action, String notes, Actor actor, LocalDateTime at) {
        dispute.getTimeline().add(new TimelineEntry(action, notes, actor.id(), actor.role(), at));
    }

    private void publish(Dispute dispute, String action, DisputeStatus fromStatus, DisputeStatus toStatus,
                         Actor actor, String notes) {
        workflowEventPublisher.publish(AuditEntityType.DISPUTE, dispute.getId(), dispute.getPropertyId(),
                action, fromStatus, toStatus, actor, notes);
    }
}
