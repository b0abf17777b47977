package com.siat.siat_backend.repository;

import com.siat.siat_backend.model.domain.Execution;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.UUID;

public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    Page<Execution> findByFlowIdAndTenantId(UUID flowId, String tenantId, Pageable pageable);

    long countByTenantId(String tenantId);

    // Executions started after a cutoff, used for the 24h stats window
    long countByTenantIdAndStartedAtAfter(String tenantId, Instant since);
}
