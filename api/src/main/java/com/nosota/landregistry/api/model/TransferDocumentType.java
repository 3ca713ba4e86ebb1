package com.nosota.landregistry.api.model;

public enum TransferDocumentType {
    SALE_AGREEMENT,
    INHERITANCE_CERTIFICATE,
    COURT_ORDER,
    ID_DOCUMENTS,
    TAX_CLEARANCE,
    VALUATION_REPORT,
    OTHER
}
