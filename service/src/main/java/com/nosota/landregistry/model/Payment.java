package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.PaymentMethod;
import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Fee payment for a property application or a transfer.
 *
 * <p>Two independent statuses:
 * <ul>
 *   <li>{@code status} - outcome reported by the payment rail (PENDING → COMPLETED | FAILED)</li>
 *   <li>{@code verificationStatus} - officer review (UNSET → VERIFIED | REJECTED), only once COMPLETED</li>
 * </ul>
 *
 * <p>Exactly one of {@code propertyId} and {@code transferId} is set.
 */
@Entity
@Table(name = "payment",
        indexes = {
                @Index(name = "idx_payment_property", columnList = "property_id"),
                @Index(name = "idx_payment_transfer", columnList = "transfer_id")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_payment_transaction_id", columnNames = "transaction_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "property_id", updatable = false)
    private UUID propertyId;

    @Column(name = "transfer_id", updatable = false)
    private UUID transferId;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private Long payerId;

    /**
     * Amount in ETB. Compared to the computed fee exactly, never rounded.
     */
    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false)
    private PaymentType paymentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false)
    private PaymentMethod paymentMethod;

    /**
     * Rail-specific details, opaque to the registry.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_method_detail", joinColumns = @JoinColumn(name = "payment_id"))
    @MapKeyColumn(name = "detail_key")
    @Column(name = "detail_value")
    private Map<String, String> paymentMethodDetails = new HashMap<>();

    /**
     * Rail transaction id, unique across all payments when present.
     */
    @Column(name = "transaction_id")
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private PaymentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false)
    private PaymentVerificationStatus verificationStatus;

    /**
     * Receipt issued when the rail reports completion, format RCP-yyyyMMdd-XXXXXX.
     */
    @Column(name = "receipt_number", length = 32)
    private String receiptNumber;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "verified_by")
    private Long verifiedBy;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
