package com.siat.siat_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.flow.FlowStep;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/** Partial update: null fields are left untouched. */
public record UpdateFlowDto(
        @Size(min = 1, max = 100) String name,
        @Size(max = 500) String description,
        FlowType type,
        @Size(min = 10, max = 2000) String prompt,
        String generatedCode,
        List<FlowStep> steps,
        Map<String, Object> config,
        List<String> tags,
        @JsonProperty("isPublic") Boolean isPublic,
        FlowStatus status
) {}
