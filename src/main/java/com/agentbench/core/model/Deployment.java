package com.agentbench.core.model;

import java.time.Instant;

/**
 * A long-lived deployment of an agent into a tier context.
 *
 * @param id              deployment id
 * @param agentId         deployed agent
 * @param userId          owner
 * @param tier            tier the deployment was routed under
 * @param provider        backend that hosts it
 * @param region          region of the hosting account
 * @param infra           backend handles
 * @param status          deploying, active, failed or deleted
 * @param healthStatus    last observed health, "unknown" until checked
 * @param lastHealthCheck time of the last health probe
 * @param error           failure reason when {@code status} is FAILED
 * @param createdAt       creation time
 */
public record Deployment(
        String id,
        String agentId,
        String userId,
        Tier tier,
        ProviderKind provider,
        String region,
        InfraHandles infra,
        DeploymentStatus status,
        String healthStatus,
        Instant lastHealthCheck,
        String error,
        Instant createdAt
) {

    public Deployment active(InfraHandles handles) {
        return new Deployment(id, agentId, userId, tier, provider, region, handles,
                DeploymentStatus.ACTIVE, healthStatus, lastHealthCheck, null, createdAt);
    }

    public Deployment failed(String reason) {
        return new Deployment(id, agentId, userId, tier, provider, region, infra,
                DeploymentStatus.FAILED, healthStatus, lastHealthCheck, reason, createdAt);
    }

    public Deployment withHealth(String health, Instant checkedAt) {
        return new Deployment(id, agentId, userId, tier, provider, region, infra,
                status, health, checkedAt, error, createdAt);
    }
}
