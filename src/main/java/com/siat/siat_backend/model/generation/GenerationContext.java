package com.siat.siat_backend.model.generation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Caller identity plus optional hints folded into the enhanced prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationContext {
    private String tenantId;
    private String userId;
    private Map<String, Object> variables;
    private List<String> functions;
    private List<String> libraries;
    private List<String> constraints;

    @JsonIgnore
    public boolean isAuditable() {
        return tenantId != null && !tenantId.isBlank() && userId != null && !userId.isBlank();
    }
}
