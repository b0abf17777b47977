package com.siat.siat_backend.model.dto;

import jakarta.validation.constraints.NotBlank;

public record SaveLlmProviderDto(
        @NotBlank String provider,
        @NotBlank String apiKey,
        String customEndpoint,
        String model
) {}
