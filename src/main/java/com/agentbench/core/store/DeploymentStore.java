package com.agentbench.core.store;

import com.agentbench.core.model.Deployment;

import java.util.List;
import java.util.Optional;

public interface DeploymentStore {

    Deployment save(Deployment deployment);

    Optional<Deployment> findById(String deploymentId);

    /** Deployments of an agent, newest first. */
    List<Deployment> findByAgent(String agentId, int limit);
}
