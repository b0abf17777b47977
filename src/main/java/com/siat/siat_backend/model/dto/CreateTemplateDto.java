package com.siat.siat_backend.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record CreateTemplateDto(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String description,
        @NotBlank String type,
        Map<String, Object> template,
        List<String> tags
) {}
