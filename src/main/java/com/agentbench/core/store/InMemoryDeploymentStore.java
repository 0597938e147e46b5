package com.agentbench.core.store;

import com.agentbench.core.model.Deployment;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDeploymentStore implements DeploymentStore {

    private final ConcurrentHashMap<String, Deployment> deployments = new ConcurrentHashMap<>();

    @Override
    public Deployment save(Deployment deployment) {
        deployments.put(deployment.id(), deployment);
        return deployment;
    }

    @Override
    public Optional<Deployment> findById(String deploymentId) {
        return Optional.ofNullable(deployments.get(deploymentId));
    }

    @Override
    public List<Deployment> findByAgent(String agentId, int limit) {
        return deployments.values().stream()
                .filter(d -> d.agentId().equals(agentId))
                .sorted(Comparator.comparing(Deployment::createdAt).reversed())
                .limit(limit)
                .toList();
    }
}
