package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.model.AuditEntry;
import com.nosota.landregistry.model.PropertyApplication;
import com.nosota.landregistry.repository.AuditEntryRepository;
import com.nosota.landregistry.security.AccessGuard;
import com.nosota.landregistry.security.Actor;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.UUID;

/**
 * Read side of the audit trail. Entries are written only by the audit listener.
 */
@Service
@Validated
@RequiredArgsConstructor
public class AuditTrailService {

    private final AuditEntryRepository auditEntryRepository;
    private final PropertyApplicationService propertyApplicationService;

    /**
     * Every entry of a property and the documents, payments, transfers and disputes attached to it,
     * oldest first. Owner or staff.
     */
    public List<AuditEntry> getPropertyActivity(@NotNull Actor actor, @NotNull UUID propertyId) {
        PropertyApplication application = propertyApplicationService.findApplication(propertyId);
        AccessGuard.owner(application.getOwnerId()).or(AccessGuard.STAFF).check(actor);
        return auditEntryRepository.findByPropertyIdOrderByOccurredAtAsc(propertyId);
    }

    /**
     * History of a single entity. Staff only.
     */
    public List<AuditEntry> getEntityActivity(@NotNull Actor actor, @NotNull AuditEntityType entityType,
                                              @NotNull UUID entityId) {
        AccessGuard.STAFF.check(actor);
        return auditEntryRepository.findByEntityTypeAndEntityIdOrderByOccurredAtAsc(entityType, entityId);
    }
}
