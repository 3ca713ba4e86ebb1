package com.nosota.landregistry.api.model;

/**
 * Kind of workflow entity an activity log entry refers to.
 */
public enum AuditEntityType {
    PROPERTY,
    DOCUMENT,
    PAYMENT,
    TRANSFER,
    DISPUTE
}
