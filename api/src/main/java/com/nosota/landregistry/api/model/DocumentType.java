package com.nosota.landregistry.api.model;

public enum DocumentType {
    TITLE_DEED,
    ID_CARD,
    TAX_CLEARANCE,
    APPLICATION_FORM,
    OTHER
}
