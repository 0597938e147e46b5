package com.agentbench.backend;

import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.routing.CredentialContext;

/**
 * Everything a backend needs to run one job.
 *
 * @param jobId          job id, also used to name backend resources
 * @param agentId        agent under test
 * @param query          input for the agent
 * @param artifact       code, dependency manifest and container descriptor
 * @param providerConfig model endpoint, model id and region
 * @param runtimeId      hosted runtime reference (managed runtime only)
 * @param timeoutMs      job timeout
 * @param credentials    account and credentials chosen by the router
 */
public record JobDescriptor(
        String jobId,
        String agentId,
        String query,
        ExecutionArtifact artifact,
        ProviderConfig providerConfig,
        String runtimeId,
        long timeoutMs,
        CredentialContext credentials
) {
}
