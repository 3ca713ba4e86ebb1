package com.nosota.landregistry.repository;

import com.nosota.landregistry.model.OwnershipRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OwnershipRecordRepository extends JpaRepository<OwnershipRecord, UUID> {

    List<OwnershipRecord> findByPropertyIdOrderByStartDateAsc(UUID propertyId);
}
