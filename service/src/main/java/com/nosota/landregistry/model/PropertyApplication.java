package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.model.PropertyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Property registration application - the aggregate root of the registration workflow.
 *
 * <p>Status lifecycle:
 * <pre>
 * PENDING → UNDER_REVIEW → {DOCUMENTS_VALIDATED, PAYMENT_COMPLETED} → APPROVED | REJECTED
 * </pre>
 *
 * <p>{@code documentsValidated} and {@code paymentCompleted} are derived from the stored documents
 * and payments. They are written only by the aggregate recomputation, never by a client.
 * APPROVED requires both flags.
 *
 * <p>The row is locked with PESSIMISTIC_WRITE by every document and payment transition, so that
 * concurrent verifications recompute the flags one after another.
 */
@Entity
@Table(name = "property_application",
        uniqueConstraints = @UniqueConstraint(name = "uk_property_plot_number_key", columnNames = "plot_number_key"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PropertyApplication {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Plot number as submitted (trimmed). Immutable after creation.
     */
    @Column(name = "plot_number", nullable = false, updatable = false, length = 50)
    private String plotNumber;

    /**
     * Upper-cased plot number, backs the case-insensitive uniqueness constraint.
     */
    @Column(name = "plot_number_key", nullable = false, updatable = false, length = 50)
    private String plotNumberKey;

    @Embedded
    private Location location;

    /**
     * Area in square metres, always positive.
     */
    @Column(name = "area", nullable = false, precision = 14, scale = 2)
    private BigDecimal area;

    @Enumerated(EnumType.STRING)
    @Column(name = "property_type", nullable = false)
    private PropertyType propertyType;

    /**
     * Current owner. Changes only when a transfer completes.
     */
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "owner_since", nullable = false)
    private LocalDateTime ownerSince;

    @Column(name = "documents_validated", nullable = false)
    private boolean documentsValidated;

    @Column(name = "payment_completed", nullable = false)
    private boolean paymentCompleted;

    /**
     * Set once an officer has started review or decided on a document or payment.
     */
    @Column(name = "review_started", nullable = false)
    private boolean reviewStarted;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private PropertyStatus status;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    /**
     * Approval notes or rejection reason.
     */
    @Column(name = "review_notes", length = 1000)
    private String reviewNotes;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    /**
     * Transfer currently in progress, null when none is active.
     */
    @Column(name = "current_transfer_id")
    private UUID currentTransferId;

    @Column(name = "has_active_dispute", nullable = false)
    private boolean hasActiveDispute;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
