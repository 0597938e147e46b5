package com.agentbench.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One submitted test run of an agent.
 * <p>
 * Jobs are immutable snapshots; stores apply changes by replacing the whole document.
 * Use {@link #toBuilder()} to derive a modified copy.
 *
 * @param id                   unique job id
 * @param userId               owning user
 * @param agentId              agent under test
 * @param query                input sent to the agent
 * @param artifact             code, dependency manifest and container descriptor
 * @param provider             backend the job is dispatched to
 * @param providerConfig       endpoint / model id / region
 * @param timeoutMs            watchdog timeout, excluding the grace period
 * @param status               lifecycle status
 * @param phase                coarse projection of {@code status}
 * @param infra                backend handles, null until dispatched
 * @param logs                 append-only log lines
 * @param logCursor            opaque backend cursor for the next log fetch, null before the first
 * @param lastLogFetchedAt     when logs were last drained
 * @param result               success flag, response, error and error stage
 * @param submittedAt          creation time
 * @param startedAt            first time the job left the queue
 * @param completedAt          set iff the status is terminal
 * @param metrics              timings and resource usage
 * @param deploymentPackageRef reference to the built package (image reference for containers)
 */
public record Job(
        String id,
        String userId,
        String agentId,
        String query,
        ExecutionArtifact artifact,
        ProviderKind provider,
        ProviderConfig providerConfig,
        long timeoutMs,
        JobStatus status,
        JobPhase phase,
        InfraHandles infra,
        List<String> logs,
        String logCursor,
        Instant lastLogFetchedAt,
        JobResult result,
        Instant submittedAt,
        Instant startedAt,
        Instant completedAt,
        JobMetrics metrics,
        String deploymentPackageRef
) {

    public Job {
        logs = logs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(logs));
        result = result == null ? JobResult.pending() : result;
        metrics = metrics == null ? JobMetrics.empty() : metrics;
        phase = status == null ? phase : status.phase();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private String agentId;
        private String query;
        private ExecutionArtifact artifact = ExecutionArtifact.empty();
        private ProviderKind provider;
        private ProviderConfig providerConfig;
        private long timeoutMs;
        private JobStatus status = JobStatus.CREATED;
        private InfraHandles infra;
        private List<String> logs = List.of();
        private String logCursor;
        private Instant lastLogFetchedAt;
        private JobResult result = JobResult.pending();
        private Instant submittedAt;
        private Instant startedAt;
        private Instant completedAt;
        private JobMetrics metrics = JobMetrics.empty();
        private String deploymentPackageRef;

        private Builder() {}

        private Builder(Job job) {
            this.id = job.id;
            this.userId = job.userId;
            this.agentId = job.agentId;
            this.query = job.query;
            this.artifact = job.artifact;
            this.provider = job.provider;
            this.providerConfig = job.providerConfig;
            this.timeoutMs = job.timeoutMs;
            this.status = job.status;
            this.infra = job.infra;
            this.logs = job.logs;
            this.logCursor = job.logCursor;
            this.lastLogFetchedAt = job.lastLogFetchedAt;
            this.result = job.result;
            this.submittedAt = job.submittedAt;
            this.startedAt = job.startedAt;
            this.completedAt = job.completedAt;
            this.metrics = job.metrics;
            this.deploymentPackageRef = job.deploymentPackageRef;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder agentId(String agentId) { this.agentId = agentId; return this; }
        public Builder query(String query) { this.query = query; return this; }
        public Builder artifact(ExecutionArtifact artifact) { this.artifact = artifact; return this; }
        public Builder provider(ProviderKind provider) { this.provider = provider; return this; }
        public Builder providerConfig(ProviderConfig providerConfig) { this.providerConfig = providerConfig; return this; }
        public Builder timeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; return this; }
        public Builder status(JobStatus status) { this.status = status; return this; }
        public Builder infra(InfraHandles infra) { this.infra = infra; return this; }
        public Builder logs(List<String> logs) { this.logs = logs; return this; }
        public Builder logCursor(String logCursor) { this.logCursor = logCursor; return this; }
        public Builder lastLogFetchedAt(Instant at) { this.lastLogFetchedAt = at; return this; }
        public Builder result(JobResult result) { this.result = result; return this; }
        public Builder submittedAt(Instant at) { this.submittedAt = at; return this; }
        public Builder startedAt(Instant at) { this.startedAt = at; return this; }
        public Builder completedAt(Instant at) { this.completedAt = at; return this; }
        public Builder metrics(JobMetrics metrics) { this.metrics = metrics; return this; }
        public Builder deploymentPackageRef(String ref) { this.deploymentPackageRef = ref; return this; }

        public Job build() {
            return new Job(id, userId, agentId, query, artifact, provider, providerConfig, timeoutMs,
                    status, status == null ? null : status.phase(), infra, logs, logCursor, lastLogFetchedAt,
                    result, submittedAt, startedAt, completedAt, metrics, deploymentPackageRef);
        }
    }
}
