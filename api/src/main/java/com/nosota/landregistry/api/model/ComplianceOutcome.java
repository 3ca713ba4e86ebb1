package com.nosota.landregistry.api.model;

/**
 * Result of a single transfer compliance check (legal, tax clearance, fraud screening).
 */
public enum ComplianceOutcome {
    PENDING,
    PASSED,
    FAILED
}
