package com.siat.siat_backend.model.dto;

import jakarta.validation.constraints.NotBlank;

// Body of the validate and optimize endpoints
public record CodeRequestDto(@NotBlank String code, @NotBlank String type) {}
