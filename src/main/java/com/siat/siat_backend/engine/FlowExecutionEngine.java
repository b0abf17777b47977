package com.siat.siat_backend.engine;

import com.siat.siat_backend.executor.StepExecutorRegistry;
import com.siat.siat_backend.model.domain.Execution;
import com.siat.siat_backend.model.domain.ExecutionStatus;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.execution.FlowExecutionResult;
import com.siat.siat_backend.model.flow.FlowStep;
import com.siat.siat_backend.repository.ExecutionRepository;
import com.siat.siat_backend.repository.FlowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs a flow's steps strictly in list order, feeding each step's output into the next.
 * Declared conditions and nextSteps are stored with the flow but not followed here.
 * The first failing step stops the run; later steps never execute.
 */
@Slf4j
@Service
public class FlowExecutionEngine {

    private final FlowRepository flowRepository;
    private final ExecutionRepository executionRepository;
    private final StepExecutorRegistry executorRegistry;
    private final FlowEventPublisher eventPublisher;

    public FlowExecutionEngine(FlowRepository flowRepository,
                               ExecutionRepository executionRepository,
                               StepExecutorRegistry executorRegistry,
                               FlowEventPublisher eventPublisher) {
        this.flowRepository = flowRepository;
        this.executionRepository = executionRepository;
        this.executorRegistry = executorRegistry;
        this.eventPublisher = eventPublisher;
    }

    public FlowExecutionResult executeFlow(UUID flowId, Map<String, Object> inputData, String executedBy) {
        Instant startedAt = Instant.now();
        List<String> logs = new ArrayList<>();
        logs.add("Starting execution of flow " + flowId);

        Optional<Flow> found = flowRepository.findById(flowId).filter(f -> f.getDeletedAt() == null);
        if (found.isEmpty()) {
            log.warn("[Runner] Flow not found: {}", flowId);
            return FlowExecutionResult.failed(null, "Flow not found: " + flowId, elapsed(startedAt), logs);
        }
        Flow flow = found.get();
        logs.add("Found flow: " + flow.getName());

        Execution execution = new Execution();
        execution.setFlowId(flowId);
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setInputData(inputData);
        execution.setExecutedBy(executedBy);
        execution.setTenantId(flow.getTenantId());
        execution.setStartedAt(startedAt);
        execution = executionRepository.save(execution);
        logs.add("Created execution record: " + execution.getId());

        Map<String, Object> output;
        try {
            output = runSteps(flow, inputData != null ? inputData : new HashMap<>(), logs);
        } catch (Exception e) {
            Instant completedAt = Instant.now();
            long duration = Duration.between(startedAt, completedAt).toMillis();
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            execution.setStatus(ExecutionStatus.FAILED);
            execution.setErrorMessage(error);
            execution.setCompletedAt(completedAt);
            execution.setDuration(duration);
            executionRepository.save(execution);

            log.error("[Runner] Flow {} failed after {}ms (execution {})", flowId, duration, execution.getId(), e);
            logs.add("Execution failed: " + error);
            notifyFinished(flowId, execution.getId(), false, duration);
            return FlowExecutionResult.failed(execution.getId().toString(), error, duration, logs);
        }

        // Steps succeeded: nothing below may turn the run into a failure
        Instant completedAt = Instant.now();
        long duration = Duration.between(startedAt, completedAt).toMillis();
        execution.setStatus(ExecutionStatus.COMPLETED);
        execution.setOutputData(output);
        execution.setCompletedAt(completedAt);
        execution.setDuration(duration);
        executionRepository.save(execution);

        try {
            flowRepository.recordExecution(flowId, completedAt);
        } catch (DataAccessException e) {
            log.error("[Runner] Could not update execution counters for flow {} (execution {})",
                    flowId, execution.getId(), e);
        }

        log.info("[Runner] Flow {} completed in {}ms (execution {})", flowId, duration, execution.getId());
        notifyFinished(flowId, execution.getId(), true, duration);
        return FlowExecutionResult.completed(execution.getId().toString(), output, duration, logs);
    }

    // Event delivery is best effort; the stored execution is the source of truth
    private void notifyFinished(UUID flowId, UUID executionId, boolean success, long duration) {
        try {
            eventPublisher.executionFinished(flowId, executionId, success, duration);
        } catch (RuntimeException e) {
            log.warn("[Runner] Could not publish execution event for flow {}: {}", flowId, e.getMessage());
        }
    }

    private Map<String, Object> runSteps(Flow flow, Map<String, Object> input, List<String> logs) {
        List<FlowStep> steps = flow.getSteps() != null ? flow.getSteps() : List.of();
        Map<String, Object> current = input;
        int index = 0;
        for (FlowStep step : steps) {
            index++;
            logs.add("Executing step " + index + ": " + (step.getName() != null ? step.getName() : "Unnamed step"));
            Map<String, Object> output = executorRegistry.get(step.getType()).execute(step, current);
            current = output != null ? output : new HashMap<>();
            logs.add("Step executed: " + (step.getType() != null ? step.getType() : "unknown"));
        }
        return current;
    }

    private static long elapsed(Instant since) {
        return Duration.between(since, Instant.now()).toMillis();
    }
}
