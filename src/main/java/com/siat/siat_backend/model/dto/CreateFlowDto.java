package com.siat.siat_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.flow.FlowStep;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record CreateFlowDto(
        @NotBlank @Size(min = 1, max = 100) String name,
        @Size(max = 500) String description,
        @NotNull FlowType type,
        @NotBlank @Size(min = 10, max = 2000) String prompt,
        List<FlowStep> steps,
        Map<String, Object> config,
        List<String> tags,
        @JsonProperty("isPublic") Boolean isPublic
) {}
