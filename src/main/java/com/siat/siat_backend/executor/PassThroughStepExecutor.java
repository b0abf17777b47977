package com.siat.siat_backend.executor;

import com.siat.siat_backend.model.flow.FlowStep;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Hands its input to the next step unchanged. Also the fallback for unknown step types. */
@Component
public class PassThroughStepExecutor implements StepExecutor {

    @Override
    public String supportedType() {
        return "start";
    }

    @Override
    public Map<String, Object> execute(FlowStep step, Map<String, Object> input) {
        return input;
    }
}
