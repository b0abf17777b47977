package com.siat.siat_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.model.flow.FlowStep;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "siat_flows")
@Data
public class Flow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FlowType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FlowStatus status = FlowStatus.DRAFT;

    @Column(nullable = false, length = 2000)
    private String prompt;

    @Column(name = "generated_code", length = 100_000)
    private String generatedCode;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> config = new HashMap<>();

    // Ordered; the runner walks this list front to back
    @JdbcTypeCode(SqlTypes.JSON)
    private List<FlowStep> steps = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> tags = new ArrayList<>();

    @Column(name = "is_public")
    @JsonProperty("isPublic")
    private boolean publicFlow = false;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "execution_count")
    private int executionCount = 0;

    @Column(name = "last_executed_at")
    private Instant lastExecutedAt;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
