package com.nosota.landregistry.repository;

import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;
import com.nosota.landregistry.dto.PaymentScope;
import com.nosota.landregistry.model.Payment;
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
public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    List<Payment> findByPropertyIdOrderByCreatedAtAsc(UUID propertyId);

    List<Payment> findByTransferIdOrderByCreatedAtAsc(UUID transferId);

    boolean existsByTransactionId(String transactionId);

    Page<Payment> findByStatusAndVerificationStatusOrderByCompletedAtAsc(PaymentStatus status,
                                                                       PaymentVerificationStatus verificationStatus,
                                                                       Pageable pageable);

    /**
     * Scope of a payment, read without loading the entity so that the owning aggregate can be
     * locked first.
     */
    @Query("""
            SELECT new com.nosota.landregistry.dto.PaymentScope(p.propertyId, p.transferId)
            FROM Payment p
            WHERE p.id = :id
            """)
    Optional<PaymentScope> findScopeById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> getOneForUpdate(@Param("id") UUID id);
}
