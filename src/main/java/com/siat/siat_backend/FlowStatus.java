package com.siat.siat_backend;

/**
 * Lifecycle of a SIAT flow: DRAFT -> GENERATING -> GENERATED | ERROR -> DEPLOYED.
 * TESTING and ARCHIVED are set manually through updates.
 */
public enum FlowStatus {
    DRAFT,
    GENERATING,
    GENERATED,
    TESTING,
    DEPLOYED,
    ERROR,
    ARCHIVED
}
