package com.siat.siat_backend.repository;

import com.siat.siat_backend.model.domain.PromptRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface PromptRecordRepository extends JpaRepository<PromptRecord, UUID> {

    List<PromptRecord> findByTenantIdAndUserIdOrderByCreatedAtDesc(String tenantId, String userId);
}
