package com.nosota.landregistry.model;

import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.api.model.DocumentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Document attached to a property application.
 *
 * <p>Only the metadata lives here. The bytes are kept by the external file store under the document id.
 *
 * <p>Status lifecycle:
 * <pre>
 * PENDING → VERIFIED | REJECTED | NEEDS_UPDATE
 * NEEDS_UPDATE | REJECTED → PENDING (owner replaces the file)
 * VERIFIED ↔ REJECTED (explicit re-verification only)
 * </pre>
 */
@Entity
@Table(name = "document", indexes = @Index(name = "idx_document_property", columnList = "property_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Document {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Owning application. Documents are never moved between applications.
     */
    @Column(name = "property_id", nullable = false, updatable = false)
    private UUID propertyId;

    /**
     * Owner of the application at upload time.
     */
    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, updatable = false)
    private DocumentType documentType;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "mime_type", nullable = false)
    private String mimeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DocumentStatus status;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    /**
     * Starts at 1, incremented on every replacement.
     */
    @Column(name = "file_version", nullable = false)
    private int fileVersion;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
