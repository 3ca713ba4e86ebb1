package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.TransferDocumentStatus;
import com.nosota.landregistry.api.model.TransferDocumentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Document submitted by a transfer party. Reviewed in batches by an officer.
 */
@Entity
@Table(name = "transfer_document", indexes = @Index(name = "idx_transfer_document_transfer", columnList = "transfer_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TransferDocument {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;

    /**
     * Party that submitted the document.
     */
    @Column(name = "submitted_by", nullable = false, updatable = false)
    private Long submittedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, updatable = false)
    private TransferDocumentType documentType;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "mime_type", nullable = false)
    private String mimeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TransferDocumentStatus status;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private LocalDateTime submittedAt;
}
