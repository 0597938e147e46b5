package com.agentbench.dispatch.api;

import com.agentbench.core.model.Deployment;
import com.agentbench.core.service.DeploymentService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/deployments")
public class DeploymentController {

    private final DeploymentService deploymentService;

    public DeploymentController(DeploymentService deploymentService) {
        this.deploymentService = deploymentService;
    }

    @PostMapping("/{deploymentId}/health")
    public Deployment checkHealth(@PathVariable String deploymentId) {
        return deploymentService.checkDeploymentHealth(deploymentId);
    }
}
