package com.nosota.landregistry.api.model;

public enum DisputeDecision {
    IN_FAVOR_OF_DISPUTANT,
    IN_FAVOR_OF_RESPONDENT,
    COMPROMISE,
    DISMISSED
}
