package com.siat.siat_backend.controller;

import com.siat.siat_backend.deployment.DeploymentService;
import com.siat.siat_backend.model.deployment.DeploymentManifest;
import com.siat.siat_backend.model.deployment.DeploymentResult;
import com.siat.siat_backend.model.deployment.DeploymentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

// Deployments live on disk and are not tenant-scoped
@RestController
@RequestMapping("/siat/deployments")
@RequiredArgsConstructor
public class DeploymentController {

    private final DeploymentService deploymentService;

    @GetMapping
    public List<DeploymentManifest> listDeployments() {
        return deploymentService.listDeployments();
    }

    @GetMapping("/{deploymentId}")
    public ResponseEntity<DeploymentStatus> getStatus(@PathVariable String deploymentId) {
        DeploymentStatus status = deploymentService.getDeploymentStatus(deploymentId);
        if (DeploymentStatus.NOT_FOUND.equals(status.status())) {
            return ResponseEntity.status(404).body(status);
        }
        return ResponseEntity.ok(status);
    }

    @DeleteMapping("/{deploymentId}")
    public DeploymentResult undeploy(@PathVariable String deploymentId) {
        return deploymentService.undeploy(deploymentId);
    }
}
