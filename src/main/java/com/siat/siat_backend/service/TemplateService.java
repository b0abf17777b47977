package com.siat.siat_backend.service;

import com.siat.siat_backend.exception.FlowStateException;
import com.siat.siat_backend.exception.SiatNotFoundException;
import com.siat.siat_backend.model.domain.SiatTemplate;
import com.siat.siat_backend.model.dto.CreateTemplateDto;
import com.siat.siat_backend.repository.SiatTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateService {

    private final SiatTemplateRepository templateRepo;

    /** Structure hints for a type: the tenant's own template wins over the system one; empty when neither exists. */
    @Transactional(readOnly = true)
    public Map<String, Object> resolveTemplate(String type, String tenantId) {
        Optional<SiatTemplate> found = Optional.empty();
        if (tenantId != null && !tenantId.isBlank()) {
            found = templateRepo.findFirstByTypeAndTenantId(type, tenantId);
        }
        if (found.isEmpty()) {
            found = templateRepo.findFirstByTypeAndSystemTrue(type);
        }
        return found.map(SiatTemplate::getTemplate)
                .map(t -> (Map<String, Object>) new HashMap<>(t))
                .orElseGet(HashMap::new);
    }

    @Transactional(readOnly = true)
    public List<SiatTemplate> list(String tenantId, String type) {
        return templateRepo.findBySystemTrueOrTenantIdOrderByNameAsc(tenantId).stream()
                .filter(t -> type == null || type.isBlank() || type.equalsIgnoreCase(t.getType()))
                .toList();
    }

    @Transactional(readOnly = true)
    public SiatTemplate get(UUID id, String tenantId) {
        SiatTemplate template = templateRepo.findById(id)
                .orElseThrow(() -> new SiatNotFoundException("SIAT template not found"));
        if (!template.isSystem() && !Objects.equals(template.getTenantId(), tenantId)) {
            throw new SiatNotFoundException("SIAT template not found");
        }
        return template;
    }

    @Transactional
    public SiatTemplate create(CreateTemplateDto dto, String tenantId, String userId) {
        SiatTemplate template = new SiatTemplate();
        template.setName(dto.name());
        template.setDescription(dto.description());
        template.setType(dto.type().toUpperCase());
        template.setTemplate(dto.template() != null ? new HashMap<>(dto.template()) : new HashMap<>());
        template.setTags(dto.tags() != null ? new ArrayList<>(dto.tags()) : new ArrayList<>());
        template.setTenantId(tenantId);
        template.setCreatedBy(userId);
        SiatTemplate saved = templateRepo.save(template);
        log.info("[Template] Created '{}' ({}) for tenant {}", saved.getName(), saved.getType(), tenantId);
        return saved;
    }

    @Transactional
    public SiatTemplate update(UUID id, CreateTemplateDto dto, String tenantId) {
        SiatTemplate template = get(id, tenantId);
        if (template.isSystem()) {
            throw new FlowStateException("System templates cannot be edited");
        }
        if (dto.name() != null) template.setName(dto.name());
        if (dto.description() != null) template.setDescription(dto.description());
        if (dto.type() != null) template.setType(dto.type().toUpperCase());
        if (dto.template() != null) template.setTemplate(new HashMap<>(dto.template()));
        if (dto.tags() != null) template.setTags(new ArrayList<>(dto.tags()));
        return templateRepo.save(template);
    }

    /** Copies any visible template (system ones included) into a tenant-owned template. */
    @Transactional
    public SiatTemplate duplicate(UUID id, String tenantId, String userId) {
        SiatTemplate source = get(id, tenantId);
        SiatTemplate copy = new SiatTemplate();
        copy.setName(source.getName() + " (Copy)");
        copy.setDescription(source.getDescription());
        copy.setType(source.getType());
        copy.setTemplate(new HashMap<>(source.getTemplate()));
        copy.setTags(new ArrayList<>(source.getTags()));
        copy.setTenantId(tenantId);
        copy.setCreatedBy(userId);
        return templateRepo.save(copy);
    }

    @Transactional
    public void delete(UUID id, String tenantId) {
        SiatTemplate template = get(id, tenantId);
        if (template.isSystem()) {
            throw new FlowStateException("System templates cannot be deleted");
        }
        templateRepo.delete(template);
        log.info("[Template] Deleted '{}' for tenant {}", template.getName(), tenantId);
    }
}
