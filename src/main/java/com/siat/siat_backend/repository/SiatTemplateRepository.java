package com.siat.siat_backend.repository;

import com.siat.siat_backend.model.domain.SiatTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SiatTemplateRepository extends JpaRepository<SiatTemplate, UUID> {

    Optional<SiatTemplate> findFirstByTypeAndTenantId(String type, String tenantId);

    Optional<SiatTemplate> findFirstByTypeAndSystemTrue(String type);

    Optional<SiatTemplate> findFirstByNameAndSystemTrue(String name);

    // System templates plus the ones owned by the tenant
    List<SiatTemplate> findBySystemTrueOrTenantIdOrderByNameAsc(String tenantId);
}
