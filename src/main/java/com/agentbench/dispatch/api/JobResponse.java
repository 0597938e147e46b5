package com.agentbench.dispatch.api;

import com.agentbench.core.model.InfraHandles;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of a job. Field names follow the persisted schema.
 */
public record JobResponse(
        String id,
        @JsonProperty("user_id") String userId,
        @JsonProperty("agent_id") String agentId,
        String query,
        String provider,
        @JsonProperty("model_id") String modelId,
        String region,
        @JsonProperty("timeout_ms") long timeoutMs,
        String status,
        String phase,
        @JsonProperty("infra") InfraHandles infra,
        List<String> logs,
        @JsonProperty("last_log_fetched_at") Instant lastLogFetchedAt,
        Boolean success,
        String response,
        String error,
        @JsonProperty("error_stage") String errorStage,
        @JsonProperty("submitted_at") Instant submittedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        JobMetrics metrics,
        @JsonProperty("deployment_package") String deploymentPackageRef
) {

    public static JobResponse from(Job job) {
        return from(job, true);
    }

    /** Without log lines, for list views. */
    public static JobResponse summary(Job job) {
        return from(job, false);
    }

    private static JobResponse from(Job job, boolean withLogs) {
        var config = job.providerConfig();
        var result = job.result();
        return new JobResponse(
                job.id(), job.userId(), job.agentId(), job.query(),
                job.provider() != null ? job.provider().tag() : null,
                config != null ? config.modelId() : null,
                config != null ? config.region() : null,
                job.timeoutMs(),
                job.status().name(), job.phase().value(),
                job.infra(),
                withLogs ? job.logs() : List.of(),
                job.lastLogFetchedAt(),
                result.success(), result.response(), result.error(), result.errorStage(),
                job.submittedAt(), job.startedAt(), job.completedAt(),
                job.metrics(),
                job.deploymentPackageRef());
    }
}
