package com.siat.siat_backend.controller;

import com.siat.siat_backend.model.deployment.DeploymentConfig;
import com.siat.siat_backend.model.deployment.DeploymentResult;
import com.siat.siat_backend.model.domain.Execution;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.dto.CreateFlowDto;
import com.siat.siat_backend.model.dto.FlowStatsDto;
import com.siat.siat_backend.model.dto.PagedResponse;
import com.siat.siat_backend.model.dto.UpdateFlowDto;
import com.siat.siat_backend.model.execution.FlowExecutionResult;
import com.siat.siat_backend.service.SiatFlowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/siat/flows")
@RequiredArgsConstructor
public class SiatFlowController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String USER_HEADER = "X-User-Id";

    private final SiatFlowService flowService;

    @PostMapping
    public ResponseEntity<Flow> createFlow(@Valid @RequestBody CreateFlowDto dto,
                                           @RequestHeader(TENANT_HEADER) String tenantId,
                                           @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(flowService.create(dto, tenantId, userId));
    }

    @GetMapping
    public PagedResponse<Flow> getFlows(@RequestParam(defaultValue = "1") int page,
                                        @RequestParam(defaultValue = "10") int limit,
                                        @RequestHeader(TENANT_HEADER) String tenantId) {
        return flowService.list(tenantId, page, limit);
    }

    @GetMapping("/stats")
    public FlowStatsDto getStats(@RequestHeader(TENANT_HEADER) String tenantId) {
        return flowService.stats(tenantId);
    }

    @GetMapping("/{flowId}")
    public Flow getFlow(@PathVariable UUID flowId, @RequestHeader(TENANT_HEADER) String tenantId) {
        return flowService.get(flowId, tenantId);
    }

    @RequestMapping(value = "/{flowId}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    public Flow updateFlow(@PathVariable UUID flowId,
                           @Valid @RequestBody UpdateFlowDto dto,
                           @RequestHeader(TENANT_HEADER) String tenantId,
                           @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        return flowService.update(flowId, dto, tenantId, userId);
    }

    @DeleteMapping("/{flowId}")
    public Map<String, Object> deleteFlow(@PathVariable UUID flowId, @RequestHeader(TENANT_HEADER) String tenantId) {
        flowService.delete(flowId, tenantId);
        return Map.of("success", true, "message", "SIAT flow deleted successfully");
    }

    @PostMapping("/{flowId}/generate")
    public Flow regenerate(@PathVariable UUID flowId,
                           @RequestHeader(TENANT_HEADER) String tenantId,
                           @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        return flowService.regenerate(flowId, tenantId, userId);
    }

    @PostMapping("/{flowId}/deploy")
    public DeploymentResult deploy(@PathVariable UUID flowId,
                                   @RequestBody(required = false) DeploymentConfig config,
                                   @RequestHeader(TENANT_HEADER) String tenantId) {
        return flowService.deploy(flowId, config != null ? config : new DeploymentConfig(), tenantId);
    }

    @PostMapping("/{flowId}/execute")
    public FlowExecutionResult execute(@PathVariable UUID flowId,
                                       @RequestBody(required = false) Map<String, Object> input,
                                       @RequestHeader(TENANT_HEADER) String tenantId,
                                       @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        return flowService.execute(flowId, input, tenantId, userId);
    }

    @PostMapping("/{flowId}/duplicate")
    public ResponseEntity<Flow> duplicate(@PathVariable UUID flowId,
                                          @RequestHeader(TENANT_HEADER) String tenantId,
                                          @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(flowService.duplicate(flowId, tenantId, userId));
    }

    @GetMapping("/{flowId}/executions")
    public PagedResponse<Execution> getExecutions(@PathVariable UUID flowId,
                                                  @RequestParam(defaultValue = "1") int page,
                                                  @RequestParam(defaultValue = "10") int limit,
                                                  @RequestHeader(TENANT_HEADER) String tenantId) {
        return flowService.executions(flowId, tenantId, page, limit);
    }
}
