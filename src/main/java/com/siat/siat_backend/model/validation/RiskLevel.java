package com.siat.siat_backend.model.validation;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(int score) {
        if (score >= 90) return LOW;
        if (score >= 70) return MEDIUM;
        if (score >= 50) return HIGH;
        return CRITICAL;
    }
}
