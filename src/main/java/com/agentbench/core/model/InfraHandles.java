package com.agentbench.core.model;

/**
 * Backend-side identifiers for a dispatched job.
 *
 * @param taskId    executor task id (container) or invocation id (managed runtime)
 * @param taskArn   fully qualified task reference, or the runtime id
 * @param logGroup  log group the task writes to
 * @param logStream log stream within the group
 */
public record InfraHandles(String taskId, String taskArn, String logGroup, String logStream) {
}
