package com.siat.siat_backend.model.validation;

public record SecurityFinding(String description, String recommendation, int severity) {}
