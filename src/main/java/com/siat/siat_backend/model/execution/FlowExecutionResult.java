package com.siat.siat_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowExecutionResult(
        boolean success,
        String executionId,
        Map<String, Object> output,
        String error,
        long duration,
        List<String> logs
) {
    public static FlowExecutionResult completed(String executionId, Map<String, Object> output, long duration, List<String> logs) {
        return new FlowExecutionResult(true, executionId, output, null, duration, logs);
    }

    public static FlowExecutionResult failed(String executionId, String error, long duration, List<String> logs) {
        return new FlowExecutionResult(false, executionId, null, error, duration, logs);
    }
}
