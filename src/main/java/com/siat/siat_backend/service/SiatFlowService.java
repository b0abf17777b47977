package com.siat.siat_backend.service;

import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.deployment.DeploymentService;
import com.siat.siat_backend.engine.FlowEventPublisher;
import com.siat.siat_backend.engine.FlowExecutionEngine;
import com.siat.siat_backend.exception.FlowStateException;
import com.siat.siat_backend.exception.InvalidPromptException;
import com.siat.siat_backend.exception.SiatNotFoundException;
import com.siat.siat_backend.generator.CodeGenerationService;
import com.siat.siat_backend.generator.ModuleScaffolder;
import com.siat.siat_backend.generator.RequirementsParser;
import com.siat.siat_backend.model.deployment.DeploymentConfig;
import com.siat.siat_backend.model.deployment.DeploymentResult;
import com.siat.siat_backend.model.domain.Execution;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.dto.CreateFlowDto;
import com.siat.siat_backend.model.dto.FlowStatsDto;
import com.siat.siat_backend.model.dto.PagedResponse;
import com.siat.siat_backend.model.dto.UpdateFlowDto;
import com.siat.siat_backend.model.execution.FlowExecutionResult;
import com.siat.siat_backend.model.flow.FlowStep;
import com.siat.siat_backend.model.generation.GenerationContext;
import com.siat.siat_backend.model.generation.GenerationResult;
import com.siat.siat_backend.model.validation.PromptValidationResult;
import com.siat.siat_backend.repository.ExecutionRepository;
import com.siat.siat_backend.repository.FlowRepository;
import com.siat.siat_backend.validation.PromptValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Tenant-scoped lifecycle of SIAT flows: create, generate, deploy, execute.
 * Generation is handed to {@link FlowGenerationWorker}; everything else runs on the request thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SiatFlowService {

    static final int MAX_PAGE_SIZE = 100;

    private final FlowRepository flowRepository;
    private final ExecutionRepository executionRepository;
    private final PromptValidator promptValidator;
    private final RequirementsParser requirementsParser;
    private final ModuleScaffolder scaffolder;
    private final CodeGenerationService generationService;
    private final FlowGenerationWorker generationWorker;
    private final DeploymentService deploymentService;
    private final FlowExecutionEngine executionEngine;
    private final FlowEventPublisher eventPublisher;

    public Flow create(CreateFlowDto dto, String tenantId, String userId) {
        log.info("[Flow] Creating SIAT flow: {} for tenant: {}", dto.name(), tenantId);
        requireValidPrompt(dto.prompt());

        List<FlowStep> steps = dto.steps() != null && !dto.steps().isEmpty()
                ? new ArrayList<>(dto.steps())
                : scaffolder.flowStructure(dto.type(), requirementsParser.parse(dto.prompt()));

        Flow flow = new Flow();
        flow.setName(dto.name());
        flow.setDescription(dto.description());
        flow.setType(dto.type());
        flow.setPrompt(dto.prompt());
        flow.setConfig(dto.config() != null ? new HashMap<>(dto.config()) : new HashMap<>());
        flow.setSteps(steps);
        flow.setTags(dto.tags() != null ? new ArrayList<>(dto.tags()) : new ArrayList<>());
        flow.setPublicFlow(Boolean.TRUE.equals(dto.isPublic()));
        flow.setTenantId(tenantId);
        flow.setCreatedBy(userId);
        flow.setStatus(FlowStatus.DRAFT);
        flow = flowRepository.save(flow);

        startGeneration(flow, userId);
        return flow;
    }

    public PagedResponse<Flow> list(String tenantId, int page, int limit) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        PageRequest request = PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt"));
        return PagedResponse.of(flowRepository.findByTenantIdAndDeletedAtIsNull(tenantId, request), safePage, safeLimit);
    }

    public Flow get(UUID id, String tenantId) {
        return flowRepository.findByIdAndTenantIdAndDeletedAtIsNull(id, tenantId)
                .orElseThrow(() -> new SiatNotFoundException("SIAT flow not found"));
    }

    public Flow update(UUID id, UpdateFlowDto dto, String tenantId, String userId) {
        if (dto.status() == FlowStatus.DEPLOYED || dto.status() == FlowStatus.GENERATING) {
            throw new FlowStateException("Status " + dto.status() + " can only be reached through "
                    + (dto.status() == FlowStatus.DEPLOYED ? "deploy" : "regenerate"));
        }
        Flow flow = get(id, tenantId);

        String generatedCode = dto.generatedCode();
        if (dto.prompt() != null && !dto.prompt().equals(flow.getPrompt())) {
            requireValidPrompt(dto.prompt());
            if (generatedCode == null) {
                // A changed prompt regenerates inline; a failed attempt keeps the old code
                String type = (dto.type() != null ? dto.type() : flow.getType()).name();
                GenerationResult result = generationService.generate(dto.prompt(), type,
                        GenerationContext.builder().tenantId(tenantId).userId(userId).build());
                if (result.isSuccess()) {
                    generatedCode = result.getCode();
                }
            }
        }

        if (dto.name() != null) flow.setName(dto.name());
        if (dto.description() != null) flow.setDescription(dto.description());
        if (dto.type() != null) flow.setType(dto.type());
        if (dto.prompt() != null) flow.setPrompt(dto.prompt());
        if (generatedCode != null) flow.setGeneratedCode(generatedCode);
        if (dto.steps() != null) flow.setSteps(new ArrayList<>(dto.steps()));
        if (dto.config() != null) flow.setConfig(new HashMap<>(dto.config()));
        if (dto.tags() != null) flow.setTags(new ArrayList<>(dto.tags()));
        if (dto.isPublic() != null) flow.setPublicFlow(dto.isPublic());
        if (dto.status() != null) flow.setStatus(dto.status());
        flow.setUpdatedAt(Instant.now());
        return flowRepository.save(flow);
    }

    public void delete(UUID id, String tenantId) {
        Flow flow = get(id, tenantId);
        flow.setDeletedAt(Instant.now());
        flowRepository.save(flow);
        log.info("[Flow] Soft-deleted flow {} for tenant {}", id, tenantId);
    }

    public FlowStatsDto stats(String tenantId) {
        long totalFlows = flowRepository.countByTenantIdAndDeletedAtIsNull(tenantId);
        long activeFlows = flowRepository.countByTenantIdAndStatusAndDeletedAtIsNull(tenantId, FlowStatus.DEPLOYED);
        long totalExecutions = executionRepository.countByTenantId(tenantId);
        long recentExecutions = executionRepository.countByTenantIdAndStartedAtAfter(
                tenantId, Instant.now().minus(Duration.ofHours(24)));
        long average = totalFlows > 0 ? Math.round((double) totalExecutions / totalFlows) : 0;
        return new FlowStatsDto(totalFlows, activeFlows, totalExecutions, recentExecutions, average);
    }

    public Flow regenerate(UUID id, String tenantId, String userId) {
        Flow flow = get(id, tenantId);
        if (flow.getStatus() == FlowStatus.GENERATING) {
            throw new FlowStateException("Flow is already being generated");
        }
        startGeneration(flow, userId);
        return flow;
    }

    public DeploymentResult deploy(UUID id, DeploymentConfig config, String tenantId) {
        Flow flow = get(id, tenantId);
        if (flow.getStatus() != FlowStatus.GENERATED) {
            throw new FlowStateException("Flow must be generated before deployment");
        }

        DeploymentResult result = deploymentService.deploy(flow, config);
        if (result.success()) {
            flow.setStatus(FlowStatus.DEPLOYED);
            flowRepository.save(flow);
            eventPublisher.statusChanged(flow.getId(), FlowStatus.DEPLOYED, null);
        } else {
            log.warn("[Flow] Deployment of flow {} failed: {}", id, result.message());
        }
        return result;
    }

    public FlowExecutionResult execute(UUID id, Map<String, Object> input, String tenantId, String userId) {
        Flow flow = get(id, tenantId);
        if (flow.getStatus() != FlowStatus.DEPLOYED) {
            throw new FlowStateException("Flow must be deployed before execution");
        }
        return executionEngine.executeFlow(flow.getId(), input != null ? input : new HashMap<>(), userId);
    }

    public Flow duplicate(UUID id, String tenantId, String userId) {
        Flow original = get(id, tenantId);

        Flow copy = new Flow();
        copy.setName(original.getName() + " (Copy)");
        copy.setDescription(original.getDescription());
        copy.setType(original.getType());
        copy.setPrompt(original.getPrompt());
        copy.setGeneratedCode(original.getGeneratedCode());
        copy.setConfig(original.getConfig() != null ? new HashMap<>(original.getConfig()) : new HashMap<>());
        copy.setSteps(original.getSteps() != null ? new ArrayList<>(original.getSteps()) : new ArrayList<>());
        copy.setTags(original.getTags() != null ? new ArrayList<>(original.getTags()) : new ArrayList<>());
        copy.setPublicFlow(false);
        copy.setStatus(FlowStatus.DRAFT);
        copy.setTenantId(tenantId);
        copy.setCreatedBy(userId);
        return flowRepository.save(copy);
    }

    public PagedResponse<Execution> executions(UUID id, String tenantId, int page, int limit) {
        get(id, tenantId);
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        PageRequest request = PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "startedAt"));
        return PagedResponse.of(executionRepository.findByFlowIdAndTenantId(id, tenantId, request), safePage, safeLimit);
    }

    private void startGeneration(Flow flow, String userId) {
        flow.setStatus(FlowStatus.GENERATING);
        flowRepository.save(flow);
        eventPublisher.statusChanged(flow.getId(), FlowStatus.GENERATING, null);
        generationWorker.generateAsync(flow.getId(), flow.getPrompt(), flow.getType().name(),
                flow.getTenantId(), Objects.requireNonNullElse(userId, flow.getCreatedBy()));
    }

    private void requireValidPrompt(String prompt) {
        PromptValidationResult validation = promptValidator.validate(prompt);
        if (!validation.isValid()) {
            throw new InvalidPromptException(validation.getErrors());
        }
    }
}
