package com.nosota.landregistry.repository;

import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.model.Document;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    List<Document> findByPropertyIdOrderByUploadedAtAsc(UUID propertyId);

    Page<Document> findByStatusOrderByUploadedAtAsc(DocumentStatus status, Pageable pageable);

    /**
     * Owning application of a document, read without loading the entity so that the
     * application can be locked before the document itself is read.
     */
    @Query("SELECT d.propertyId FROM Document d WHERE d.id = :id")
    Optional<UUID> findPropertyIdById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Document d WHERE d.id = :id")
    Optional<Document> getOneForUpdate(@Param("id") UUID id);
}
