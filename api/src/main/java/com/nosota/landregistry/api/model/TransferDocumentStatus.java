package com.nosota.landregistry.api.model;

public enum TransferDocumentStatus {
    PENDING,
    VERIFIED,
    REJECTED
}
