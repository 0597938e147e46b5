package com.agentbench.core.service;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendRegistry;
import com.agentbench.backend.BackendStatus;
import com.agentbench.backend.ExecutionBackend;
import com.agentbench.backend.JobDescriptor;
import com.agentbench.backend.PollResult;
import com.agentbench.core.error.AgentBenchException;
import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.UsageLimitExceededException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.Deployment;
import com.agentbench.core.model.DeploymentStatus;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.routing.CredentialContext;
import com.agentbench.core.routing.DeploymentRouter;
import com.agentbench.core.routing.RoutingPlan;
import com.agentbench.core.store.AgentStore;
import com.agentbench.core.store.DeploymentStore;
import com.agentbench.core.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Long-lived agent deployments: route, submit to the chosen backend, record the outcome.
 */
@Service
public class DeploymentService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);

    static final String HEALTHY = "healthy";
    static final String UNHEALTHY = "unhealthy";

    private final AgentStore agents;
    private final UserStore userStore;
    private final UserService users;
    private final DeploymentStore deployments;
    private final DeploymentRouter router;
    private final BackendRegistry backends;
    private final SubmissionProperties submission;
    private final Clock clock;

    public DeploymentService(AgentStore agents, UserStore userStore, UserService users,
                             DeploymentStore deployments, DeploymentRouter router, BackendRegistry backends,
                             SubmissionProperties submission, Clock clock) {
        this.agents = agents;
        this.userStore = userStore;
        this.users = users;
        this.deployments = deployments;
        this.router = router;
        this.backends = backends;
        this.submission = submission;
        this.clock = clock;
    }

    /**
     * Deploys an agent into the context its owner's tier calls for. Platform-account deployments
     * count against the monthly usage; the charge is given back when the backend rejects the
     * deployment. The deployment record is kept either way.
     */
    public Deployment deployAgent(String agentId, String userId) {
        Agent agent = agents.findById(agentId)
                .orElseThrow(() -> new ValidationException("Agent not found: " + agentId));
        if (!agent.ownerId().equals(userId)) {
            throw new ValidationException("Only the owner can deploy agent " + agentId);
        }
        UserAccount user = users.getOrProvision(userId);
        RoutingPlan plan = router.plan(user, agent);

        boolean charged = !plan.ownAccount() && plan.charge() != null;
        if (charged && !userStore.tryIncrementUsage(userId, plan.charge().monthlyCap())) {
            throw new UsageLimitExceededException("Monthly limit of " + plan.charge().monthlyCap()
                    + " reached for user " + userId);
        }

        Deployment deployment = deployments.save(new Deployment(UUID.randomUUID().toString(), agentId, userId,
                plan.tier(), plan.provider(), plan.region(), null, DeploymentStatus.DEPLOYING, "unknown", null,
                null, now()));
        log.info("Deploying agent {} as {} on {} in {}", agentId, deployment.id(), plan.provider().tag(),
                plan.region());

        try {
            CredentialContext credentials = router.resolveCredentials(userId, plan.tier(), plan.region());
            ProviderConfig providerConfig = agent.providerConfig() != null
                    ? agent.providerConfig().withRegion(plan.region()) : null;
            JobDescriptor descriptor = new JobDescriptor(deployment.id(), agentId, "", agent.artifact(),
                    providerConfig, agent.runtimeId(), submission.getDefaultTimeoutMs(), credentials);
            BackendHandle handle = backends.forProvider(plan.provider()).submit(descriptor);
            return deployments.save(deployment.active(handle.toInfraHandles()));
        } catch (AgentBenchException e) {
            log.warn("Deployment {} failed: {}", deployment.id(), e.getMessage());
            deployments.save(deployment.failed(e.getMessage()));
            if (charged) {
                userStore.refundUsage(userId);
            }
            throw e;
        }
    }

    public List<Deployment> getDeployments(String agentId, Integer limit) {
        int size = limit == null || limit <= 0 ? 20 : Math.min(limit, 100);
        return deployments.findByAgent(agentId, size);
    }

    /**
     * Polls the backend once and records the observed health.
     */
    public Deployment checkDeploymentHealth(String deploymentId) {
        Deployment deployment = deployments.findById(deploymentId)
                .orElseThrow(() -> new JobNotFoundException("Deployment", deploymentId));
        if (deployment.status() != DeploymentStatus.ACTIVE || deployment.infra() == null) {
            return deployments.save(deployment.withHealth(UNHEALTHY, now()));
        }
        String health;
        try {
            ExecutionBackend backend = backends.forProvider(deployment.provider());
            PollResult result = backend.poll(BackendHandle.fromInfra(deployment.provider(), deployment.infra()));
            health = result.status() == BackendStatus.FAILED ? UNHEALTHY : HEALTHY;
        } catch (AgentBenchException e) {
            log.warn("Health check of deployment {} failed: {}", deploymentId, e.getMessage());
            health = UNHEALTHY;
        }
        return deployments.save(deployment.withHealth(health, now()));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
