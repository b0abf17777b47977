package com.siat.siat_backend.executor;

import com.siat.siat_backend.model.flow.FlowStep;

import java.util.Map;

public interface StepExecutor {

    // Step type this executor handles, matched case-insensitively
    String supportedType();

    // Output becomes the next step's input; throwing fails the whole execution
    Map<String, Object> execute(FlowStep step, Map<String, Object> input);
}
