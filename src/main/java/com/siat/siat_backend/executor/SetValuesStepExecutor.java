package com.siat.siat_backend.executor;

import com.siat.siat_backend.model.flow.FlowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SetValuesStepExecutor implements StepExecutor {

    private final StepReferenceResolver resolver;

    @Override
    public String supportedType() {
        return "set";
    }

    // Copies the input and overlays config.values (resolved against the input) on top of it
    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> execute(FlowStep step, Map<String, Object> input) {
        Map<String, Object> config = step.getConfig() != null ? step.getConfig() : Map.of();
        Map<String, Object> values = (Map<String, Object>) config.getOrDefault("values", new HashMap<>());

        Map<String, Object> output = new LinkedHashMap<>(input != null ? input : Map.of());
        output.putAll(resolver.resolveMap(values, input));
        return output;
    }
}
