package com.siat.siat_backend.executor;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Step type to executor. Types without a registered executor run as pass-through. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StepExecutorRegistry {

    private final List<StepExecutor> executors;
    private final PassThroughStepExecutor passThrough;
    private final Map<String, StepExecutor> registry = new HashMap<>();

    @PostConstruct
    public void init() {
        executors.forEach(executor -> registry.put(key(executor.supportedType()), executor));
        log.info("[Runner] Registered step executors: {}", registry.keySet());
    }

    public StepExecutor get(String type) {
        if (type == null) return passThrough;
        return registry.getOrDefault(key(type), passThrough);
    }

    public boolean isSupported(String type) {
        return type != null && registry.containsKey(key(type));
    }

    private static String key(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
