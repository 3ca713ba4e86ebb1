package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.TransferType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Past ownership period of a property, appended when a transfer completes.
 */
@Entity
@Table(name = "ownership_record", indexes = @Index(name = "idx_ownership_property", columnList = "property_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class OwnershipRecord {

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

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDateTime startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDateTime endDate;

    /**
     * How the outgoing owner's period ended.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "acquisition_type", nullable = false, updatable = false)
    private TransferType acquisitionType;

    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;
}
