package com.nosota.landregistry.api.model;

public enum TransferType {
    SALE,
    INHERITANCE,
    GIFT,
    COURT_ORDER,
    GOVERNMENT_ACQUISITION,
    EXCHANGE,
    OTHER
}
