package com.siat.siat_backend.model.domain;

import java.util.Optional;

public enum FlowType {
    CRUD,
    WORKFLOW,
    REPORT,
    DASHBOARD,
    API,
    FORM,
    AUTOMATION,
    INTEGRATION;

    /** Lenient lookup used where the generator receives a free-form type string. */
    public static Optional<FlowType> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(FlowType.valueOf(value.trim().toUpperCase()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
