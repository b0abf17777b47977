package com.siat.siat_backend.model.deployment;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentResult(boolean success, String message, String deploymentId) {

    public static DeploymentResult ok(String message, String deploymentId) {
        return new DeploymentResult(true, message, deploymentId);
    }

    public static DeploymentResult failure(String message) {
        return new DeploymentResult(false, message, null);
    }
}
