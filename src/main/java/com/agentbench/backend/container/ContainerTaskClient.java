package com.agentbench.backend.container;

import com.agentbench.backend.LogPage;
import com.agentbench.core.routing.CredentialContext;

import java.util.List;
import java.util.Map;

/**
 * Narrow view of an elastic container executor: launch a task, inspect it, stop it, read its logs.
 */
public interface ContainerTaskClient {

    /**
     * @throws com.agentbench.core.error.QuotaExceededException if the executor has no capacity
     * @throws com.agentbench.core.error.InfraException         for any other launch failure
     */
    LaunchedTask launch(TaskLaunchRequest request);

    /**
     * @throws com.agentbench.core.error.BackendNotFoundException if the task is unknown
     */
    TaskState describe(String taskId);

    void stop(String taskId, String reason);

    LogPage readLogs(String taskId, String logGroup, String logStream, String cursor);

    /**
     * @param taskName       unique name, also used as the log stream
     * @param image          image reference to run
     * @param environment    container environment
     * @param cpuUnits       cpu units (1024 = one vCPU)
     * @param memoryMb       memory limit
     * @param cluster        executor cluster
     * @param logGroup       log group to write to
     * @param subnets        network placement chosen by the router
     * @param securityGroups network policy chosen by the router
     * @param credentials    account the task runs in
     */
    record TaskLaunchRequest(
            String taskName,
            String image,
            Map<String, String> environment,
            int cpuUnits,
            int memoryMb,
            String cluster,
            String logGroup,
            List<String> subnets,
            List<String> securityGroups,
            CredentialContext credentials
    ) {}

    record LaunchedTask(String taskId, String taskArn) {}

    /**
     * @param lastStatus    PROVISIONING, PENDING, RUNNING or STOPPED
     * @param exitCode      container exit code once stopped, else null
     * @param stoppedReason executor supplied reason, may be null
     * @param memoryUsedMb  memory usage if known
     * @param cpuUsed       cpu usage if known
     */
    record TaskState(String lastStatus, Integer exitCode, String stoppedReason, Long memoryUsedMb, Double cpuUsed) {

        public boolean isStopped() {
            return "STOPPED".equals(lastStatus);
        }

        public boolean isRunning() {
            return "RUNNING".equals(lastStatus);
        }
    }
}
