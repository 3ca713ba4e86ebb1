package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.AuditEntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only record of one workflow transition. Never updated, never deleted.
 */
@Entity
@Table(name = "audit_entry", indexes = {
        @Index(name = "idx_audit_property", columnList = "property_id"),
        @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id")
})
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AuditEntry {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false)
    private AuditEntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Column(name = "property_id", updatable = false)
    private UUID propertyId;

    /**
     * Transition name, e.g. DOCUMENT_VERIFIED or TRANSFER_COMPLETED.
     */
    @Column(name = "action", nullable = false, updatable = false, length = 64)
    private String action;

    @Column(name = "from_status", updatable = false, length = 32)
    private String fromStatus;

    @Column(name = "to_status", updatable = false, length = 32)
    private String toStatus;

    /**
     * Null for transitions derived by the system.
     */
    @Column(name = "actor_id", updatable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", updatable = false)
    private ActorRole actorRole;

    @Column(name = "notes", updatable = false, length = 2000)
    private String notes;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;
}
