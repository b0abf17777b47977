package com.siat.siat_backend.model.deployment;

import java.util.Map;

public record DeploymentStatus(String status, Map<String, Object> details) {

    public static final String DEPLOYED  = "deployed";
    public static final String NOT_FOUND = "not_found";
    public static final String ERROR     = "error";

    public boolean isDeployed() {
        return DEPLOYED.equals(status);
    }
}
