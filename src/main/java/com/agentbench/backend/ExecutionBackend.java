package com.agentbench.backend;

import com.agentbench.core.model.ProviderKind;

/**
 * Execution backend contract, one implementation per {@link ProviderKind}.
 * <p>
 * Implementations:
 * <ul>
 *   <li>{@link com.agentbench.backend.container.ContainerBackend}: builds an image and runs it as a
 *       task on a container executor</li>
 *   <li>{@link com.agentbench.backend.runtime.ManagedRuntimeBackend}: invokes a hosted agent runtime</li>
 * </ul>
 * Both report through the same poll/log shape so the scheduler never branches on the backend kind.
 */
public interface ExecutionBackend {

    ProviderKind kind();

    /**
     * Starts the job.
     *
     * @throws com.agentbench.core.error.BuildException         if the artifact could not be built
     * @throws com.agentbench.core.error.QuotaExceededException if the executor is out of capacity
     * @throws com.agentbench.core.error.InfraException         for any other backend failure
     */
    BackendHandle submit(JobDescriptor descriptor);

    /**
     * Observes the job once.
     *
     * @throws com.agentbench.core.error.BackendNotFoundException if the backend no longer knows the handle
     * @throws com.agentbench.core.error.InfraException           if the backend could not be reached
     */
    PollResult poll(BackendHandle handle);

    /**
     * Best-effort cancellation. Failures are logged, never thrown.
     */
    void cancel(BackendHandle handle);

    /**
     * Returns log lines after {@code cursor} (null for the beginning). Safe to call repeatedly.
     */
    LogPage fetchLogs(BackendHandle handle, String cursor);
}
