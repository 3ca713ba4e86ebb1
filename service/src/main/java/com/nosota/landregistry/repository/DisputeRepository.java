package com.nosota.landregistry.repository;

import com.nosota.landregistry.api.model.DisputeStatus;
import com.nosota.landregistry.model.Dispute;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Dispute d WHERE d.id = :id")
    Optional<Dispute> getOneForUpdate(@Param("id") UUID id);

    boolean existsByPropertyIdAndStatusIn(UUID propertyId, Collection<DisputeStatus> statuses);

    boolean existsByPropertyIdAndDisputantIdAndStatusIn(UUID propertyId, Long disputantId,
                                                        Collection<DisputeStatus> statuses);

    Page<Dispute> findByStatusOrderByCreatedAtDesc(DisputeStatus status, Pageable pageable);

    Page<Dispute> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<Dispute> findByDisputantIdOrderByCreatedAtDesc(Long disputantId, Pageable pageable);
}
