package com.nosota.landregistry.repository;

import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.model.PropertyApplication;
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
public interface PropertyApplicationRepository extends JpaRepository<PropertyApplication, UUID> {

    /**
     * Loads the application and locks its row for the rest of the transaction.
     *
     * <p>Every document and payment transition goes through this lock before recomputing the
     * derived flags, so concurrent verifications on one application are serialized.
     *
     * @param id Application id
     * @return The locked application, empty if unknown
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PropertyApplication p WHERE p.id = :id")
    Optional<PropertyApplication> getOneForUpdate(@Param("id") UUID id);

    boolean existsByPlotNumberKey(String plotNumberKey);

    Page<PropertyApplication> findByOwnerIdOrderByCreatedAtDesc(Long ownerId, Pageable pageable);

    Page<PropertyApplication> findByStatusOrderByCreatedAtDesc(PropertyStatus status, Pageable pageable);

    Page<PropertyApplication> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Ids of applications that are still open, used by the drift reconciliation job.
     */
    @Query("""
            SELECT p.id
            FROM PropertyApplication p
            WHERE p.status NOT IN :statuses
            """)
    List<UUID> findIdsByStatusNotIn(@Param("statuses") Collection<PropertyStatus> statuses);
}
