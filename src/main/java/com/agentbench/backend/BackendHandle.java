package com.agentbench.backend;

import com.agentbench.core.model.InfraHandles;
import com.agentbench.core.model.ProviderKind;

/**
 * Reference to work running on a backend.
 *
 * @param provider    backend that owns the handle
 * @param taskId      task or invocation id
 * @param taskArn     fully qualified task reference or runtime id
 * @param logGroup    log group, may be null
 * @param logStream   log stream, may be null
 * @param imageRef    built image, null when no build happened
 * @param buildTimeMs time spent building, 0 when no build happened
 */
public record BackendHandle(
        ProviderKind provider,
        String taskId,
        String taskArn,
        String logGroup,
        String logStream,
        String imageRef,
        long buildTimeMs
) {

    public InfraHandles toInfraHandles() {
        return new InfraHandles(taskId, taskArn, logGroup, logStream);
    }

    /** Rebuilds a handle from what the job record keeps. */
    public static BackendHandle fromInfra(ProviderKind provider, InfraHandles infra) {
        return new BackendHandle(provider, infra.taskId(), infra.taskArn(), infra.logGroup(), infra.logStream(),
                null, 0L);
    }
}
