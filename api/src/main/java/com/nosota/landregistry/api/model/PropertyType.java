package com.nosota.landregistry.api.model;

public enum PropertyType {
    RESIDENTIAL,
    COMMERCIAL,
    INDUSTRIAL,
    AGRICULTURAL
}
