package com.agentbench.core.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Limits applied to test submissions.
 */
@Component
@ConfigurationProperties(prefix = "agentbench.submission")
public class SubmissionProperties {

    private long defaultTimeoutMs = 180_000;
    private long minTimeoutMs = 1000;
    private long maxTimeoutMs = 600_000;
    private int defaultPriority = 2;
    private int maxQueryLength = 2000;
    private int maxAgentCodeBytes = 100 * 1024;
    private int maxRequirementsBytes = 10 * 1024;
    private int maxDockerfileBytes = 5 * 1024;
    /** Used for the estimated wait returned on submission. */
    private int secondsPerQueuedJob = 30;

    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
    public long getMinTimeoutMs() { return minTimeoutMs; }
    public void setMinTimeoutMs(long minTimeoutMs) { this.minTimeoutMs = minTimeoutMs; }
    public long getMaxTimeoutMs() { return maxTimeoutMs; }
    public void setMaxTimeoutMs(long maxTimeoutMs) { this.maxTimeoutMs = maxTimeoutMs; }
    public int getDefaultPriority() { return defaultPriority; }
    public void setDefaultPriority(int defaultPriority) { this.defaultPriority = defaultPriority; }
    public int getMaxQueryLength() { return maxQueryLength; }
    public void setMaxQueryLength(int maxQueryLength) { this.maxQueryLength = maxQueryLength; }
    public int getMaxAgentCodeBytes() { return maxAgentCodeBytes; }
    public void setMaxAgentCodeBytes(int maxAgentCodeBytes) { this.maxAgentCodeBytes = maxAgentCodeBytes; }
    public int getMaxRequirementsBytes() { return maxRequirementsBytes; }
    public void setMaxRequirementsBytes(int maxRequirementsBytes) { this.maxRequirementsBytes = maxRequirementsBytes; }
    public int getMaxDockerfileBytes() { return maxDockerfileBytes; }
    public void setMaxDockerfileBytes(int maxDockerfileBytes) { this.maxDockerfileBytes = maxDockerfileBytes; }
    public int getSecondsPerQueuedJob() { return secondsPerQueuedJob; }
    public void setSecondsPerQueuedJob(int secondsPerQueuedJob) { this.secondsPerQueuedJob = secondsPerQueuedJob; }
}
