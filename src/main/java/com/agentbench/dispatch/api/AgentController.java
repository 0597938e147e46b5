package com.agentbench.dispatch.api;

import com.agentbench.core.model.Agent;
import com.agentbench.core.model.Deployment;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.service.AgentService;
import com.agentbench.core.service.DeploymentService;
import com.agentbench.core.service.TestExecutionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for agents: registration, test history and deployments.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentService agentService;
    private final TestExecutionService testService;
    private final DeploymentService deploymentService;

    public AgentController(AgentService agentService, TestExecutionService testService,
                           DeploymentService deploymentService) {
        this.agentService = agentService;
        this.testService = testService;
        this.deploymentService = deploymentService;
    }

    @PostMapping
    public ResponseEntity<Agent> register(@RequestHeader(TestController.USER_HEADER) String userId,
                                          @Valid @RequestBody RegisterAgentRequest request) {
        Agent agent = agentService.registerAgent(new Agent(request.id(), userId, request.name(),
                new ExecutionArtifact(request.agentCode(), request.requirements(), request.dockerfile()),
                new ProviderConfig(request.modelEndpoint(), request.modelId(), request.region()),
                request.runtimeId(), request.isPublic()));
        return ResponseEntity.status(HttpStatus.CREATED).body(agent);
    }

    @GetMapping("/{agentId}")
    public Agent get(@PathVariable String agentId) {
        return agentService.getAgent(agentId);
    }

    /**
     * GET /api/v1/agents/{id}/history: Test jobs of the agent, newest first.
     */
    @GetMapping("/{agentId}/history")
    public List<JobResponse> history(@PathVariable String agentId,
                                     @RequestParam(required = false) Integer limit) {
        return testService.getDeploymentHistory(agentId, limit).stream().map(JobResponse::summary).toList();
    }

    @PostMapping("/{agentId}/deploy")
    public ResponseEntity<Deployment> deploy(@RequestHeader(TestController.USER_HEADER) String userId,
                                             @PathVariable String agentId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(deploymentService.deployAgent(agentId, userId));
    }

    @GetMapping("/{agentId}/deployments")
    public List<Deployment> deployments(@PathVariable String agentId,
                                        @RequestParam(required = false) Integer limit) {
        return deploymentService.getDeployments(agentId, limit);
    }
}
