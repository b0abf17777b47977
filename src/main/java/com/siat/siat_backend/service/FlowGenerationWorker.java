package com.siat.siat_backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.engine.FlowEventPublisher;
import com.siat.siat_backend.generator.CodeGenerationService;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.generation.GenerationContext;
import com.siat.siat_backend.model.generation.GenerationResult;
import com.siat.siat_backend.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Background code generation for a flow. Lives in its own bean so the @Async proxy is honoured
 * when called from {@link SiatFlowService}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowGenerationWorker {

    private final CodeGenerationService generationService;
    private final FlowRepository flowRepository;
    private final FlowEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Async("generationExecutor")
    public void generateAsync(UUID flowId, String prompt, String type, String tenantId, String userId) {
        generate(flowId, prompt, type, tenantId, userId);
    }

    /** Runs generation on the calling thread and stores the outcome on the flow. */
    public void generate(UUID flowId, String prompt, String type, String tenantId, String userId) {
        GenerationContext context = GenerationContext.builder().tenantId(tenantId).userId(userId).build();
        GenerationResult result;
        try {
            result = generationService.generate(prompt, type, context);
        } catch (Exception e) {
            log.error("[Worker] Code generation failed for flow: {}", flowId, e);
            result = GenerationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (result.isSuccess()) {
            try {
                markGenerated(flowId, result);
            } catch (DataAccessException e) {
                log.error("[Worker] Could not store generated code for flow: {}", flowId, e);
                markFailed(flowId, "Could not store generated code: " + e.getMostSpecificCause().getMessage());
            }
        } else {
            markFailed(flowId, result.getError());
        }
    }

    private void markGenerated(UUID flowId, GenerationResult result) {
        Flow flow = flowRepository.findById(flowId).orElse(null);
        if (flow == null) {
            log.warn("[Worker] Flow {} disappeared before generation finished", flowId);
            return;
        }
        Map<String, Object> config = new HashMap<>(flow.getConfig() != null ? flow.getConfig() : Map.of());
        if (result.getModuleConfig() != null) {
            config.putAll(result.getModuleConfig());
        }
        config.put("generatedAt", Instant.now().toString());
        if (result.getMetadata() != null) {
            config.put("metadata", objectMapper.convertValue(result.getMetadata(), Map.class));
        }
        flow.setStatus(FlowStatus.GENERATED);
        flow.setGeneratedCode(result.getCode());
        flow.setConfig(config);
        flowRepository.save(flow);

        log.info("[Worker] Code generation completed for flow: {}", flowId);
        notifyStatus(flowId, FlowStatus.GENERATED, null);
    }

    private void markFailed(UUID flowId, String error) {
        Flow flow = flowRepository.findById(flowId).orElse(null);
        if (flow == null) {
            log.warn("[Worker] Flow {} disappeared before generation failed: {}", flowId, error);
            return;
        }
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("error", error);
        config.put("errorAt", Instant.now().toString());
        flow.setStatus(FlowStatus.ERROR);
        flow.setConfig(config);
        flowRepository.save(flow);

        log.warn("[Worker] Flow {} marked ERROR: {}", flowId, error);
        notifyStatus(flowId, FlowStatus.ERROR, error);
    }

    // The stored status is authoritative; a lost event must not rewrite it
    private void notifyStatus(UUID flowId, FlowStatus status, String error) {
        try {
            eventPublisher.statusChanged(flowId, status, error);
        } catch (RuntimeException e) {
            log.warn("[Worker] Could not publish {} event for flow {}: {}", status, flowId, e.getMessage());
        }
    }
}
