package com.nosota.landregistry.repository;

import com.nosota.landregistry.model.TransferDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TransferDocumentRepository extends JpaRepository<TransferDocument, UUID> {

    List<TransferDocument> findByTransferIdOrderBySubmittedAtAsc(UUID transferId);
}
