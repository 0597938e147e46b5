package com.agentbench.core.model;

/**
 * Timing and resource usage recorded for a job. Any field may be null when not yet known.
 */
public record JobMetrics(
        Long executionTimeMs,
        Long buildTimeMs,
        Long queueWaitMs,
        Long memoryUsedMb,
        Double cpuUsed
) {

    public static JobMetrics empty() {
        return new JobMetrics(null, null, null, null, null);
    }

    public JobMetrics withExecutionTime(long ms) {
        return new JobMetrics(ms, buildTimeMs, queueWaitMs, memoryUsedMb, cpuUsed);
    }

    public JobMetrics withBuildTime(long ms) {
        return new JobMetrics(executionTimeMs, ms, queueWaitMs, memoryUsedMb, cpuUsed);
    }

    public JobMetrics withQueueWait(long ms) {
        return new JobMetrics(executionTimeMs, buildTimeMs, ms, memoryUsedMb, cpuUsed);
    }

    public JobMetrics withResources(Long memoryMb, Double cpu) {
        return new JobMetrics(executionTimeMs, buildTimeMs, queueWaitMs,
                memoryMb != null ? memoryMb : memoryUsedMb,
                cpu != null ? cpu : cpuUsed);
    }
}
