package com.siat.siat_backend.model.deployment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Content of deployment.json, written once per deployment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentManifest {
    private String deploymentId;
    private String flowId;
    private String flowName;
    private String flowType;
    private String version;
    private String deployedAt;
    private String status;
    private List<String> files;
    private Map<String, Object> config;
    private Map<String, Object> metadata;
}
