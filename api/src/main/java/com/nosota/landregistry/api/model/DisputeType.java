package com.nosota.landregistry.api.model;

public enum DisputeType {
    OWNERSHIP_DISPUTE,
    BOUNDARY_DISPUTE,
    DOCUMENTATION_ERROR,
    FRAUDULENT_REGISTRATION,
    INHERITANCE_DISPUTE,
    OTHER
}
