package com.agentbench.core.model;

/**
 * A registered agent configuration. Agents are produced by the external agent builder.
 *
 * @param id             agent id
 * @param ownerId        owning user
 * @param name           display name
 * @param artifact       generated code, dependency manifest and container descriptor
 * @param providerConfig model endpoint, model id and region
 * @param runtimeId      hosted runtime reference for managed-runtime dispatch, may be null
 * @param isPublic       whether other users may test it
 */
public record Agent(
        String id,
        String ownerId,
        String name,
        ExecutionArtifact artifact,
        ProviderConfig providerConfig,
        String runtimeId,
        boolean isPublic
) {

    public boolean visibleTo(String userId) {
        return isPublic || ownerId.equals(userId);
    }
}
