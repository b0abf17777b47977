package com.siat.siat_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/** Audit row for every generation attempt made on behalf of a known tenant and user. */
@Entity
@Table(name = "siat_prompts")
@Data
public class PromptRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 2000)
    private String prompt;

    @Column(nullable = false)
    private String type;

    @Column(name = "generated_code", length = 100_000)
    private String generatedCode;

    private boolean success;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
