package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.ComplianceOutcome;
import com.nosota.landregistry.api.model.RiskLevel;
import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.api.model.TransferType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Ownership transfer of an approved property.
 *
 * <p>Status lifecycle:
 * <pre>
 * INITIATED → DOCUMENTS_PENDING → DOCUMENTS_SUBMITTED → UNDER_REVIEW → COMPLIANCE_CHECK → APPROVED → COMPLETED
 * </pre>
 * REJECTED and CANCELLED are reachable from every state before COMPLETED.
 *
 * <p>COMPLETED is the only state allowed to change the property owner. The transfer row and the
 * property row are locked and written in one database transaction.
 */
@Entity
@Table(name = "transfer", indexes = {
        @Index(name = "idx_transfer_property", columnList = "property_id"),
        @Index(name = "idx_transfer_status", columnList = "status")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Transfer {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "property_id", nullable = false, updatable = false)
    private UUID propertyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_type", nullable = false, updatable = false)
    private TransferType transferType;

    @Column(name = "transfer_reason", nullable = false, length = 1000)
    private String transferReason;

    /**
     * Owner of the property when the transfer was initiated.
     */
    @Column(name = "previous_owner_id", nullable = false, updatable = false)
    private Long previousOwnerId;

    @Column(name = "new_owner_id", nullable = false, updatable = false)
    private Long newOwnerId;

    @Column(name = "transfer_value_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal transferValueAmount;

    @Column(name = "transfer_value_currency", nullable = false, length = 3)
    private String transferValueCurrency;

    @Column(name = "initiated_by", nullable = false, updatable = false)
    private Long initiatedBy;

    @Column(name = "initiation_date", nullable = false, updatable = false)
    private LocalDateTime initiationDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TransferStatus status;

    /**
     * Set when a TRANSFER_FEE payment is completed and verified.
     */
    @Column(name = "fee_paid", nullable = false)
    private boolean feePaid;

    @Enumerated(EnumType.STRING)
    @Column(name = "legal_compliance", nullable = false)
    private ComplianceOutcome legalCompliance;

    @Enumerated(EnumType.STRING)
    @Column(name = "tax_clearance", nullable = false)
    private ComplianceOutcome taxClearance;

    @Enumerated(EnumType.STRING)
    @Column(name = "fraud_screening", nullable = false)
    private ComplianceOutcome fraudScreening;

    @Enumerated(EnumType.STRING)
    @Column(name = "fraud_risk_level")
    private RiskLevel fraudRiskLevel;

    @Column(name = "compliance_notes", length = 1000)
    private String complianceNotes;

    @Column(name = "compliance_checked_by")
    private Long complianceCheckedBy;

    @Column(name = "compliance_checked_at")
    private LocalDateTime complianceCheckedAt;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "review_notes", length = 1000)
    private String reviewNotes;

    /**
     * Reason given on rejection or cancellation.
     */
    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "completion_date")
    private LocalDateTime completionDate;

    /**
     * Append-only history of the transfer.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "transfer_timeline", joinColumns = @JoinColumn(name = "transfer_id"))
    @OrderColumn(name = "entry_index")
    private List<TimelineEntry> timeline = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean allComplianceChecksPassed() {
        return legalCompliance == ComplianceOutcome.PASSED
                && taxClearance == ComplianceOutcome.PASSED
                && fraudScreening == ComplianceOutcome.PASSED;
    }

    public boolean isParty(Long actorId) {
        return previousOwnerId.equals(actorId) || newOwnerId.equals(actorId);
    }
}
