package com.siat.siat_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/** Stored credentials for one remote generation provider. At most one row per provider. */
@Entity
@Table(name = "siat_llm_provider_configs")
@Data
public class LlmProviderConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, unique = true)
    private LlmProvider provider;

    @Column(name = "api_key", nullable = false)
    private String apiKey;

    @Column(name = "custom_endpoint")
    private String customEndpoint;

    // Overrides the client's default model when set
    private String model;

    @Column(nullable = false)
    private boolean enabled = true;

    // Outcome of the last connection test, null until one has run
    @Column(name = "last_tested_at")
    private Instant lastTestedAt;

    @Column(name = "last_test_ok")
    private Boolean lastTestOk;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
