package com.siat.siat_backend.model.dto;

import com.siat.siat_backend.model.generation.GenerationContext;
import jakarta.validation.constraints.NotBlank;

public record GenerateCodeDto(
        @NotBlank String prompt,
        @NotBlank String type,
        GenerationContext context
) {}
