package com.agentbench.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Queue worker settings.
 */
@Component
@ConfigurationProperties(prefix = "agentbench.scheduler")
public class SchedulerProperties {

    private boolean enabled = true;
    private String workerId = "worker-" + ProcessHandle.current().pid();
    private long pollIntervalMs = 5000;
    private long cleanupIntervalMs = 60_000;
    /** Upper bound on entries claimed by one tick. */
    private int claimBatchSize = 3;
    /** Upper bound on BUILDING plus RUNNING jobs across all workers. */
    private int maxConcurrent = 10;
    private int retryCeiling = 3;
    private long watchdogGraceMs = 30_000;
    private long claimTimeoutMs = 15 * 60 * 1000L;
    private long backendPollIntervalMs = 2000;
    private long drainTimeoutSeconds = 30;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public long getCleanupIntervalMs() { return cleanupIntervalMs; }
    public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    public int getClaimBatchSize() { return claimBatchSize; }
    public void setClaimBatchSize(int claimBatchSize) { this.claimBatchSize = claimBatchSize; }
    public int getMaxConcurrent() { return maxConcurrent; }
    public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
    public int getRetryCeiling() { return retryCeiling; }
    public void setRetryCeiling(int retryCeiling) { this.retryCeiling = retryCeiling; }
    public long getWatchdogGraceMs() { return watchdogGraceMs; }
    public void setWatchdogGraceMs(long watchdogGraceMs) { this.watchdogGraceMs = watchdogGraceMs; }
    public long getClaimTimeoutMs() { return claimTimeoutMs; }
    public void setClaimTimeoutMs(long claimTimeoutMs) { this.claimTimeoutMs = claimTimeoutMs; }
    public long getBackendPollIntervalMs() { return backendPollIntervalMs; }
    public void setBackendPollIntervalMs(long backendPollIntervalMs) { this.backendPollIntervalMs = backendPollIntervalMs; }
    public long getDrainTimeoutSeconds() { return drainTimeoutSeconds; }
    public void setDrainTimeoutSeconds(long drainTimeoutSeconds) { this.drainTimeoutSeconds = drainTimeoutSeconds; }
}
