package com.siat.siat_backend.executor;

import com.siat.siat_backend.model.flow.FlowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MapperStepExecutor implements StepExecutor {

    private final StepReferenceResolver resolver;

    @Override
    public String supportedType() {
        return "mapper";
    }

    /*
     * Config shape:
     * {
     *   "output": {
     *     "email": "{{customer.email}}",
     *     "total": "{{input.order.total}}",
     *     "plan":  "premium"
     *   }
     * }
     *
     * The resolved map replaces the data handed to the next step.
     */
    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> execute(FlowStep step, Map<String, Object> input) {
        Map<String, Object> config = step.getConfig() != null ? step.getConfig() : Map.of();
        Map<String, Object> outputTemplate = (Map<String, Object>) config.getOrDefault("output", new HashMap<>());
        return resolver.resolveMap(outputTemplate, input);
    }
}
