package com.siat.siat_backend.model.dto;

public record FlowStatsDto(
        long totalFlows,
        long activeFlows,
        long totalExecutions,
        long recentExecutions,
        long averageExecutionsPerFlow
) {}
