package com.siat.siat_backend.repository;

import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.model.domain.Flow;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlowRepository extends JpaRepository<Flow, UUID> {

    Page<Flow> findByTenantIdAndDeletedAtIsNull(String tenantId, Pageable pageable);

    Optional<Flow> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, String tenantId);

    List<Flow> findByTenantIdAndDeletedAtIsNull(String tenantId);

    long countByTenantIdAndDeletedAtIsNull(String tenantId);

    long countByTenantIdAndStatusAndDeletedAtIsNull(String tenantId, FlowStatus status);

    // Single statement so concurrent executions cannot lose increments
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update Flow f set f.executionCount = f.executionCount + 1, f.lastExecutedAt = :executedAt where f.id = :flowId")
    int recordExecution(@Param("flowId") UUID flowId, @Param("executedAt") Instant executedAt);
}
