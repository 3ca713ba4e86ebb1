package com.nosota.landregistry.repository;

import com.nosota.landregistry.api.model.TransferStatus;
import com.nosota.landregistry.model.Transfer;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransferRepository extends JpaRepository<Transfer, UUID> {

    /**
     * Loads the transfer and locks its row. Transfer transitions lock the transfer first and
     * the property second.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transfer t WHERE t.id = :id")
    Optional<Transfer> getOneForUpdate(@Param("id") UUID id);

    boolean existsByPropertyIdAndStatusNotIn(UUID propertyId, Collection<TransferStatus> statuses);

    List<Transfer> findByPropertyIdOrderByCreatedAtDesc(UUID propertyId);

    Page<Transfer> findByStatusOrderByCreatedAtDesc(TransferStatus status, Pageable pageable);

    Page<Transfer> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("""
            SELECT t
            FROM Transfer t
            WHERE t.previousOwnerId = :actorId
               OR t.newOwnerId = :actorId
            ORDER BY t.createdAt DESC
            """)
    Page<Transfer> findByParty(@Param("actorId") Long actorId, Pageable pageable);
}
