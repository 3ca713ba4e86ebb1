package com.nosota.landregistry.api.model;

/**
 * Handling priority of a dispute. Always computed at read time, never stored.
 */
public enum DisputePriority {
    LOW,
    MEDIUM,
    HIGH
}
