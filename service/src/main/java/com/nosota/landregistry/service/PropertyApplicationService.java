package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.request.SubmitPropertyRequest;
import com.nosota.landregistry.api.request.UpdatePropertyRequest;
import com.nosota.landregistry.api.response.WorkflowStatusResponse;
import com.nosota.landregistry.dto.AggregateFlags;
import com.nosota.landregistry.dto.FeeQuote;
import com.nosota.landregistry.error.ConflictException;
import com.nosota.landregistry.error.InvalidStateException;
import com.nosota.landregistry.error.NotFoundException;
import com.nosota.landregistry.error.PreconditionFailedException;
import com.nosota.landregistry.error.WorkflowValidationException;
import com.nosota.landregistry.event.WorkflowEventPublisher;
import com.nosota.landregistry.model.Document;
import com.nosota.landregistry.model.Location;
import com.nosota.landregistry.model.OwnershipRecord;
import com.nosota.landregistry.model.Payment;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.repository.DocumentRepository;
import com.nosota.landregistry.repository.OwnershipRecordRepository;
import com.nosota.landregistry.repository.PaymentRepository;
import com.nosota.landregistry.repository.PropertyApplicationRepository;
import com.nosota.landregistry.security.AccessGuard;
import com.nosota.landregistry.security.Actor;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Property application workflow: submission, review, approval and rejection, plus the
 * recomputation of the two derived flags that gate approval.
 *
 * <p>Every mutation locks the application row with PESSIMISTIC_WRITE first. Document and payment
 * transitions call {@link #refreshAggregate(PropertyApplication)} while still holding that lock.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PropertyApplicationService {

    private final PropertyApplicationRepository propertyApplicationRepository;
    private final DocumentRepository documentRepository;
    private final PaymentRepository paymentRepository;
    private final OwnershipRecordRepository ownershipRecordRepository;
    private final AggregateStatusProjection aggregateStatusProjection;
    private final FeeCalculationService feeCalculationService;
    private final WorkflowEventPublisher workflowEventPublisher;
    private final Clock clock;

    /**
     * Submits a new registration application owned by the caller.
     *
     * <p>Plot numbers are unique regardless of case. The check runs before the insert, and the
     * unique index on {@code plot_number_key} catches a concurrent submission of the same plot.
     *
     * @param actor   Caller, becomes the owner
     * @param request Application details
     * @return The persisted application in PENDING
     * @throws ConflictException           if the plot number is already registered
     * @throws WorkflowValidationException if the area is not positive
     */
    @Transactional
    public PropertyApplication submit(@NotNull Actor actor, @NotNull SubmitPropertyRequest request) {
        if (request.area() == null || request.area().compareTo(BigDecimal.ZERO) <= 0) {
            throw new WorkflowValidationException("Area must be a positive number, got: " + request.area());
        }
        String plotNumber = request.plotNumber().trim();
        String plotNumberKey = plotNumber.toUpperCase(Locale.ROOT);

        if (propertyApplicationRepository.existsByPlotNumberKey(plotNumberKey)) {
            throw duplicatePlot(plotNumber);
        }

        LocalDateTime now = LocalDateTime.now(clock);

        PropertyApplication application = new PropertyApplication();
        application.setPlotNumber(plotNumber);
        application.setPlotNumberKey(plotNumberKey);
        application.setLocation(new Location(request.kebele(), request.subCity(), request.latitude(), request.longitude()));
        application.setArea(request.area());
        application.setPropertyType(request.propertyType());
        application.setOwnerId(actor.id());
        application.setOwnerSince(now);
        application.setStatus(PropertyStatus.PENDING);
        application.setCreatedAt(now);
        application.setUpdatedAt(now);

        try {
            application = propertyApplicationRepository.saveAndFlush(application);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent submission of plot {} lost the race on the unique index", plotNumber);
            throw duplicatePlot(plotNumber);
        }

        log.info("Property application {} submitted for plot {} by {}", application.getId(), plotNumber, actor);
        workflowEventPublisher.publish(AuditEntityType.PROPERTY, application.getId(), application.getId(),
                "APPLICATION_SUBMITTED", null, PropertyStatus.PENDING, actor, null);
        return application;
    }

    /**
     * Edits the location, area or type of an application that no officer has touched yet.
     * The plot number stays as submitted.
     *
     * <p>A type change alters the required document set, so the derived flags are recomputed. The
     * registration fee is re-quoted and recorded on the audit entry.
     *
     * @throws com.nosota.landregistry.error.ForbiddenOperationException if the caller does not own the application
     * @throws ConflictException           if the application is not PENDING
     * @throws WorkflowValidationException if the new area is not positive
     */
    @Transactional
    public PropertyApplication update(@NotNull Actor actor, @NotNull UUID propertyId,
                                      @NotNull UpdatePropertyRequest request) {
        PropertyApplication application = lockApplication(propertyId);
        AccessGuard.owner(application.getOwnerId()).check(actor);
        requireOpen(application);
        if (application.getStatus() != PropertyStatus.PENDING) {
            throw new ConflictException(String.format(
                    "Property application %s can only be edited while PENDING, it is %s",
                    propertyId, application.getStatus()));
        }
        if (request.area() != null && request.area().compareTo(BigDecimal.ZERO) <= 0) {
            throw new WorkflowValidationException("Area must be a positive number, got: " + request.area());
        }

        Location location = application.getLocation();
        if (request.kebele() != null && !request.kebele().isBlank()) {
            location.setKebele(request.kebele().trim());
        }
        if (request.subCity() != null && !request.subCity().isBlank()) {
            location.setSubCity(request.subCity().trim());
        }
        if (request.latitude() != null) {
            location.setLatitude(request.latitude());
        }
        if (request.longitude() != null) {
            location.setLongitude(request.longitude());
        }
        if (request.area() != null) {
            application.setArea(request.area());
        }
        if (request.propertyType() != null) {
            application.setPropertyType(request.propertyType());
        }
        application.setUpdatedAt(LocalDateTime.now(clock));

        refreshAggregate(application);
        FeeQuote fee = feeCalculationService.registrationFee(application.getPropertyType(), application.getArea());

        log.info("Property application {} updated by {}, registration fee now {} {}",
                propertyId, actor, fee.amount(), fee.currency());
        workflowEventPublisher.publish(AuditEntityType.PROPERTY, propertyId, propertyId,
                "APPLICATION_UPDATED", PropertyStatus.PENDING, application.getStatus(), actor,
                String.format("registration fee re-quoted at %s %s", fee.amount().toPlainString(), fee.currency()));
        return application;
    }

    public PropertyApplication getProperty(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = findApplication(propertyId);
        readGuard(application).check(actor);
        return application;
    }

    public Page<PropertyApplication> listMyProperties(@NotNull Actor actor, int page, int size) {
        return propertyApplicationRepository.findByOwnerIdOrderByCreatedAtDesc(actor.id(), PageRequest.of(page, size));
    }

    public Page<PropertyApplication> listProperties(@NotNull Actor actor, PropertyStatus status, int page, int size) {
        AccessGuard.STAFF.check(actor);
        PageRequest pageable = PageRequest.of(page, size);
        return status != null
                ? propertyApplicationRepository.findByStatusOrderByCreatedAtDesc(status, pageable)
                : propertyApplicationRepository.findAllByOrderByCreatedAtDesc(pageable);
    }

    public List<OwnershipRecord> getOwnershipHistory(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = findApplication(propertyId);
        readGuard(application).check(actor);
        return ownershipRecordRepository.findByPropertyIdOrderByStartDateAsc(propertyId);
    }

    /**
     * Workflow summary of an application: flags as recomputed now, readiness, and the next step.
     *
     * <p>Read-only. Drifted stored flags are reported as recomputed and corrected by the next
     * transition or the reconciliation job.
     */
    public WorkflowStatusResponse getWorkflowStatus(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = findApplication(propertyId);
        readGuard(application).check(actor);

        List<Document> documents = documentRepository.findByPropertyIdOrderByUploadedAtAsc(propertyId);
        List<Payment> payments = paymentRepository.findByPropertyIdOrderByCreatedAtAsc(propertyId);
        AggregateFlags flags = aggregateStatusProjection.project(application.getPropertyType(), documents, payments);

        List<String> missing = application.getStatus().isTerminal()
                ? List.of()
                : aggregateStatusProjection.missingConditions(flags);

        return new WorkflowStatusResponse(
                propertyId,
                aggregateStatusProjection.deriveStatus(application.getStatus(), flags, application.isReviewStarted()),
                flags.documentsValidated(),
                flags.paymentCompleted(),
                !application.getStatus().isTerminal() && flags.readyForApproval(),
                missing,
                nextStep(application, flags, documents, payments));
    }

    /**
     * Moves a PENDING application to UNDER_REVIEW.
     *
     * @throws InvalidStateException if the application is not PENDING
     */
    @Transactional
    public PropertyApplication startReview(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = lockApplication(propertyId);
        AccessGuard.STAFF.and(AccessGuard.notSelf(application.getOwnerId())).check(actor);

        if (application.getStatus() != PropertyStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Review can only be started on a PENDING application, application %s is %s",
                    propertyId, application.getStatus()));
        }

        application.setReviewStarted(true);
        application.setStatus(PropertyStatus.UNDER_REVIEW);
        application.setUpdatedAt(LocalDateTime.now(clock));

        workflowEventPublisher.publish(AuditEntityType.PROPERTY, propertyId, propertyId,
                "REVIEW_STARTED", PropertyStatus.PENDING, PropertyStatus.UNDER_REVIEW, actor, null);
        return application;
    }

    /**
     * Approves an application.
     *
     * <p>The flags are recomputed under the lock before the gate is evaluated, so a stale stored
     * flag can neither block nor allow an approval.
     *
     * @throws com.nosota.landregistry.error.ForbiddenOperationException if the caller is not staff, or owns the application
     * @throws ConflictException           if the application is already approved or rejected
     * @throws PreconditionFailedException naming each missing condition
     */
    @Transactional
    public PropertyApplication approve(@NotNull Actor actor, @NotNull UUID propertyId, String notes) {
        PropertyApplication application = lockApplication(propertyId);
        AccessGuard.STAFF.and(AccessGuard.notSelf(application.getOwnerId())).check(actor);
        requireOpen(application);

        AggregateFlags flags = reconcile(application);
        if (!flags.readyForApproval()) {
            throw new PreconditionFailedException("approve application " + propertyId,
                    aggregateStatusProjection.missingConditions(flags));
        }

        PropertyStatus fromStatus = application.getStatus();
        LocalDateTime now = LocalDateTime.now(clock);
        application.setStatus(PropertyStatus.APPROVED);
        application.setReviewedBy(actor.id());
        application.setReviewNotes(notes);
        application.setReviewedAt(now);
        application.setUpdatedAt(now);

        log.info("Property application {} approved by {}", propertyId, actor);
        workflowEventPublisher.publish(AuditEntityType.PROPERTY, propertyId, propertyId,
                "APPLICATION_APPROVED", fromStatus, PropertyStatus.APPROVED, actor, notes);
        return application;
    }

    /**
     * Rejects an application from any non-terminal state.
     *
     * @throws WorkflowValidationException if the reason is blank
     * @throws ConflictException           if the application is already approved or rejected
     */
    @Transactional
    public PropertyApplication reject(@NotNull Actor actor, @NotNull UUID propertyId, String reason) {
        PropertyApplication application = lockApplication(propertyId);
        AccessGuard.STAFF.and(AccessGuard.notSelf(application.getOwnerId())).check(actor);

        if (reason == null || reason.isBlank()) {
            throw new WorkflowValidationException("A rejection reason is required");
        }
        requireOpen(application);

        PropertyStatus fromStatus = application.getStatus();
        LocalDateTime now = LocalDateTime.now(clock);
        application.setStatus(PropertyStatus.REJECTED);
        application.setReviewedBy(actor.id());
        application.setReviewNotes(reason.trim());
        application.setReviewedAt(now);
        application.setUpdatedAt(now);

        log.info("Property application {} rejected by {}: {}", propertyId, actor, reason);
        workflowEventPublisher.publish(AuditEntityType.PROPERTY, propertyId, propertyId,
                "APPLICATION_REJECTED", fromStatus, PropertyStatus.REJECTED, actor, reason.trim());
        return application;
    }

    /**
     * Loads and locks an application for the rest of the current transaction.
     *
     * @throws NotFoundException if the id is unknown
     */
    public PropertyApplication lockApplication(UUID propertyId) {
        return propertyApplicationRepository.getOneForUpdate(propertyId)
                .orElseThrow(() -> NotFoundException.of("Property application", propertyId));
    }

    public PropertyApplication findApplication(UUID propertyId) {
        return propertyApplicationRepository.findById(propertyId)
                .orElseThrow(() -> NotFoundException.of("Property application", propertyId));
    }

    /**
     * Records that an officer has acted on the application. Takes effect on the next refresh.
     */
    public void markReviewStarted(PropertyApplication application) {
        application.setReviewStarted(true);
    }

    /**
     * Recomputes the derived flags and status after a document or payment transition.
     * Caller must hold the application lock.
     *
     * <p>Flag changes here are the expected outcome of the transition and are published as
     * derived events.
     */
    public AggregateFlags refreshAggregate(PropertyApplication application) {
        return applyFlags(application, project(application), false);
    }

    /**
     * Recomputes the derived flags and corrects stored values that disagree, with a warning.
     * Caller must hold the application lock.
     */
    public AggregateFlags reconcile(PropertyApplication application) {
        return applyFlags(application, project(application), true);
    }

    /**
     * Ids of applications that are neither approved nor rejected.
     */
    public List<UUID> openApplicationIds() {
        return propertyApplicationRepository.findIdsByStatusNotIn(
                EnumSet.of(PropertyStatus.APPROVED, PropertyStatus.REJECTED));
    }

    /**
     * Locks and reconciles one application. Used by the reconciliation job.
     *
     * @return true if stored flags or status were corrected
     */
    @Transactional
    public boolean reconcileApplication(UUID propertyId) {
        PropertyApplication application = lockApplication(propertyId);
        boolean documentsValidated = application.isDocumentsValidated();
        boolean paymentCompleted = application.isPaymentCompleted();
        PropertyStatus status = application.getStatus();

        reconcile(application);

        return documentsValidated != application.isDocumentsValidated()
                || paymentCompleted != application.isPaymentCompleted()
                || status != application.getStatus();
    }

    private AggregateFlags project(PropertyApplication application) {
        List<Document> documents = documentRepository.findByPropertyIdOrderByUploadedAtAsc(application.getId());
        List<Payment> payments = paymentRepository.findByPropertyIdOrderByCreatedAtAsc(application.getId());
        return aggregateStatusProjection.project(application.getPropertyType(), documents, payments);
    }

    private AggregateFlags applyFlags(PropertyApplication application, AggregateFlags flags, boolean driftCheck) {
        UUID propertyId = application.getId();
        boolean documentsChanged = application.isDocumentsValidated() != flags.documentsValidated();
        boolean paymentChanged = application.isPaymentCompleted() != flags.paymentCompleted();

        if (driftCheck && (documentsChanged || paymentChanged)) {
            log.warn("Stored flags of application {} drifted: documentsValidated {} → {}, paymentCompleted {} → {}. " +
                            "Correcting in place",
                    propertyId, application.isDocumentsValidated(), flags.documentsValidated(),
                    application.isPaymentCompleted(), flags.paymentCompleted());
        }

        PropertyStatus fromStatus = application.getStatus();
        PropertyStatus toStatus = aggregateStatusProjection.deriveStatus(fromStatus, flags, application.isReviewStarted());

        application.setDocumentsValidated(flags.documentsValidated());
        application.setPaymentCompleted(flags.paymentCompleted());
        application.setStatus(toStatus);
        if (documentsChanged || paymentChanged || fromStatus != toStatus) {
            application.setUpdatedAt(LocalDateTime.now(clock));
        }

        if (documentsChanged) {
            workflowEventPublisher.publishDerived(AuditEntityType.PROPERTY, propertyId, propertyId,
                    flags.documentsValidated() ? "ALL_DOCUMENTS_VALIDATED" : "DOCUMENT_VALIDATION_REVOKED",
                    fromStatus, toStatus, driftCheck ? "corrected drifted flag" : null);
        }
        if (paymentChanged) {
            workflowEventPublisher.publishDerived(AuditEntityType.PROPERTY, propertyId, propertyId,
                    flags.paymentCompleted() ? "REGISTRATION_PAYMENT_COMPLETED" : "REGISTRATION_PAYMENT_REVOKED",
                    fromStatus, toStatus, driftCheck ? "corrected drifted flag" : null);
        }
        if (!documentsChanged && !paymentChanged && fromStatus != toStatus) {
            workflowEventPublisher.publishDerived(AuditEntityType.PROPERTY, propertyId, propertyId,
                    "STATUS_CHANGED", fromStatus, toStatus, null);
        }
        return flags;
    }

    /**
     * @throws ConflictException if the application is already approved or rejected
     */
    public void requireOpen(PropertyApplication application) {
        if (application.getStatus().isTerminal()) {
            throw new ConflictException(String.format("Property application %s is already %s",
                    application.getId(), application.getStatus()));
        }
    }

    private String nextStep(PropertyApplication application, AggregateFlags flags,
                            List<Document> documents, List<Payment> payments) {
        if (application.getStatus().isTerminal()) {
            return "None: application is " + application.getStatus();
        }
        if (!flags.documentsValidated()) {
            Set<String> missingTypes = aggregateStatusProjection
                    .missingDocumentTypes(application.getPropertyType(), documents).stream()
                    .map(Enum::name)
                    .collect(Collectors.toCollection(TreeSet::new));
            if (!missingTypes.isEmpty()) {
                return "Upload required documents: " + String.join(", ", missingTypes);
            }
            return "Replace rejected documents or wait for document verification";
        }
        if (!flags.paymentCompleted()) {
            if (payments.isEmpty()) {
                return String.format("Pay the registration fee of %s %s",
                        feeCalculationService.registrationFee(application.getPropertyType(), application.getArea()).amount(),
                        feeCalculationService.currency());
            }
            return "Wait for registration fee verification";
        }
        return "Wait for officer approval";
    }

    private static AccessGuard readGuard(PropertyApplication application) {
        return AccessGuard.ownerOrAnyOf(application.getOwnerId(), ActorRole.LAND_OFFICER, ActorRole.ADMIN);
    }

    private static ConflictException duplicatePlot(String plotNumber) {
        return new ConflictException("Plot number " + plotNumber + " is already registered");
    }
}
