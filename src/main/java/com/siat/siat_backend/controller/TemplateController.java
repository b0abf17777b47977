package com.siat.siat_backend.controller;

import com.siat.siat_backend.model.domain.SiatTemplate;
import com.siat.siat_backend.model.dto.CreateTemplateDto;
import com.siat.siat_backend.service.TemplateService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/siat/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateService templateService;

    @GetMapping
    public List<SiatTemplate> listTemplates(@RequestParam(required = false) String type,
                                            @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId) {
        return templateService.list(tenantId, type);
    }

    @GetMapping("/{templateId}")
    public SiatTemplate getTemplate(@PathVariable UUID templateId,
                                    @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId) {
        return templateService.get(templateId, tenantId);
    }

    @PostMapping
    public ResponseEntity<SiatTemplate> createTemplate(@Valid @RequestBody CreateTemplateDto dto,
                                                       @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId,
                                                       @RequestHeader(value = SiatFlowController.USER_HEADER, defaultValue = "system") String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.create(dto, tenantId, userId));
    }

    @PatchMapping("/{templateId}")
    public SiatTemplate updateTemplate(@PathVariable UUID templateId,
                                       @Valid @RequestBody CreateTemplateDto dto,
                                       @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId) {
        return templateService.update(templateId, dto, tenantId);
    }

    @PostMapping("/{templateId}/duplicate")
    public ResponseEntity<SiatTemplate> duplicateTemplate(@PathVariable UUID templateId,
                                                          @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId,
                                                          @RequestHeader(value = SiatFlowController.USER_HEADER, defaultValue = "system") String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.duplicate(templateId, tenantId, userId));
    }

    @DeleteMapping("/{templateId}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable UUID templateId,
                                               @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId) {
        templateService.delete(templateId, tenantId);
        return ResponseEntity.noContent().build();
    }
}
