package com.siat.siat_backend.model.deployment;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a single deployment. Unknown keys are kept and echoed into the manifest.
 */
@Data
public class DeploymentConfig {

    private boolean containerized;
    private String environment;
    private boolean autoStart;

    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }
}
