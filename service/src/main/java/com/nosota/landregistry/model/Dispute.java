package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.DisputeDecision;
import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.api.model.DisputeType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Dispute raised by a citizen against a property.
 *
 * <p>Priority is not stored. It is recomputed from {@code disputeType} and {@code createdAt} on every read.
 */
@Entity
@Table(name = "dispute", indexes = {
        @Index(name = "idx_dispute_property", columnList = "property_id"),
        @Index(name = "idx_dispute_disputant", columnList = "disputant_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Dispute {

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

    @Column(name = "disputant_id", nullable = false, updatable = false)
    private Long disputantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dispute_type", nullable = false, updatable = false)
    private DisputeType disputeType;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    /**
     * Officer assigned by an admin, optional.
     */
    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "assigned_at")
    private LocalDateTime assignedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DisputeStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "dispute_timeline", joinColumns = @JoinColumn(name = "dispute_id"))
    @OrderColumn(name = "entry_index")
    private List<TimelineEntry> timeline = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "decision")
    private DisputeDecision decision;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    @Column(name = "action_required", length = 1000)
    private String actionRequired;

    @Column(name = "resolved_by")
    private Long resolvedBy;

    @Column(name = "resolution_date")
    private LocalDateTime resolutionDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
