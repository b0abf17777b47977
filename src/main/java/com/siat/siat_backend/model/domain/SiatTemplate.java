package com.siat.siat_backend.model.domain;

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

/**
 * Structural hints for a generation type (imports, decorators, methods, ...).
 * System templates have no tenant and are read-only; tenant templates shadow them per type.
 */
@Entity
@Table(name = "siat_templates")
@Data
public class SiatTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    // CONTROLLER, SERVICE, DTO, ENTITY or a FlowType name
    @Column(nullable = false)
    private String type;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> template = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> tags = new ArrayList<>();

    @Column(name = "is_system")
    private boolean system = false;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
