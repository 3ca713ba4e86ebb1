package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.ActorRole;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One entry of the append-only timeline kept on transfers and disputes.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TimelineEntry {

    @Column(name = "action", nullable = false)
    private String action;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "performed_by", nullable = false)
    private Long performedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "performed_by_role", nullable = false)
    private ActorRole performedByRole;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime timestamp;
}
