package com.nosota.landregistry.repository;

import com.nosota.landregistry.api.model.AuditEntityType;
import com.nosota.landregistry.model.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of audit entries. Only {@code save} and reads are used.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, UUID> {

    List<AuditEntry> findByPropertyIdOrderByOccurredAtAsc(UUID propertyId);

    List<AuditEntry> findByEntityTypeAndEntityIdOrderByOccurredAtAsc(AuditEntityType entityType, UUID entityId);
}
