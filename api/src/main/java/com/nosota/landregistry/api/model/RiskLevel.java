package com.nosota.landregistry.api.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
