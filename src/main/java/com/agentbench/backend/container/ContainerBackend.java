package com.agentbench.backend.container;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendProperties;
import com.agentbench.backend.ExecutionBackend;
import com.agentbench.backend.JobDescriptor;
import com.agentbench.backend.LogPage;
import com.agentbench.backend.PollResult;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.routing.AssumedCredentials;
import com.agentbench.core.routing.CredentialContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Container path: build and push an image, launch it as a task, inspect the task until it stops.
 *
 * <p>Each task receives:
 * <ul>
 *   <li>{@code TEST_ID}, {@code TEST_QUERY}, {@code MODEL_PROVIDER}, {@code LOG_LEVEL}</li>
 *   <li>model settings: {@code OLLAMA_BASE_URL}/{@code OLLAMA_MODEL} or {@code AWS_REGION}/{@code BEDROCK_MODEL_ID}</li>
 *   <li>the artifact base64 encoded as {@code AGENT_CODE_B64}, {@code REQUIREMENTS_B64}, {@code DOCKERFILE_B64}</li>
 *   <li>assumed-role credentials when the job runs in the user's own account</li>
 * </ul>
 */
public class ContainerBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(ContainerBackend.class);

    private static final int MAX_LOG_PAGES = 1000;

    private final ImageBuilder imageBuilder;
    private final ContainerTaskClient taskClient;
    private final BackendProperties properties;
    private final Clock clock;

    public ContainerBackend(ImageBuilder imageBuilder, ContainerTaskClient taskClient,
                            BackendProperties properties, Clock clock) {
        this.imageBuilder = Objects.requireNonNull(imageBuilder);
        this.taskClient = Objects.requireNonNull(taskClient);
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.CONTAINER;
    }

    @Override
    public BackendHandle submit(JobDescriptor descriptor) {
        ImageBuilder.BuiltImage image = imageBuilder.build(descriptor.jobId(), descriptor.artifact());
        log.info("Built image {} for job {} in {}ms", image.imageRef(), descriptor.jobId(), image.buildTimeMs());

        String taskName = taskName(descriptor.jobId());
        var container = properties.getContainer();
        var request = new ContainerTaskClient.TaskLaunchRequest(
                taskName,
                image.imageRef(),
                environment(descriptor),
                container.getCpuUnits(),
                container.getMemoryMb(),
                container.getCluster(),
                container.getLogGroup(),
                container.getSubnets(),
                container.getSecurityGroups(),
                descriptor.credentials());

        ContainerTaskClient.LaunchedTask task = taskClient.launch(request);
        log.info("Launched task {} ({}) for job {}", task.taskId(), taskName, descriptor.jobId());
        return new BackendHandle(ProviderKind.CONTAINER, task.taskId(), task.taskArn(),
                container.getLogGroup(), taskName, image.imageRef(), image.buildTimeMs());
    }

    @Override
    public PollResult poll(BackendHandle handle) {
        ContainerTaskClient.TaskState state = taskClient.describe(handle.taskId());
        if (!state.isStopped()) {
            return state.isRunning() ? PollResult.running(List.of()) : PollResult.pending();
        }

        List<String> lines = readAllLogs(handle);
        PollResult result = ResultMarkers.succeeded(lines, state.exitCode())
                ? PollResult.succeeded(ResultMarkers.response(lines))
                : PollResult.failed(ResultMarkers.error(lines, state.exitCode(), state.stoppedReason()));
        return result.withUsage(state.memoryUsedMb(), state.cpuUsed());
    }

    @Override
    public void cancel(BackendHandle handle) {
        try {
            taskClient.stop(handle.taskId(), "Stopped by scheduler");
            log.info("Stopped task {}", handle.taskId());
        } catch (Exception e) {
            log.warn("Failed to stop task {}: {}", handle.taskId(), e.getMessage());
        }
    }

    @Override
    public LogPage fetchLogs(BackendHandle handle, String cursor) {
        return taskClient.readLogs(handle.taskId(), handle.logGroup(), handle.logStream(), cursor);
    }

    // ── Internals ────────────────────────────────────────────────────────

    String taskName(String jobId) {
        String suffix = jobId.length() > 8 ? jobId.substring(jobId.length() - 8) : jobId;
        return "test-" + suffix + "-" + clock.millis();
    }

    Map<String, String> environment(JobDescriptor descriptor) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("TEST_ID", descriptor.jobId());
        env.put("TEST_QUERY", descriptor.query());
        env.put("LOG_LEVEL", properties.getContainer().getLogLevel());

        ProviderConfig config = descriptor.providerConfig();
        CredentialContext credentials = descriptor.credentials();
        if (config != null && config.isFoundationModel()) {
            env.put("MODEL_PROVIDER", "bedrock");
            env.put("AWS_REGION", firstNonBlank(config.region(), credentials != null ? credentials.region() : null,
                    properties.getDefaultRegion()));
            env.put("BEDROCK_MODEL_ID", config.modelId());
        } else {
            env.put("MODEL_PROVIDER", "ollama");
            if (config != null) {
                putIfPresent(env, "OLLAMA_BASE_URL", config.endpoint());
                putIfPresent(env, "OLLAMA_MODEL", config.modelId());
            }
        }

        ExecutionArtifact artifact = descriptor.artifact();
        if (artifact != null) {
            env.put("AGENT_CODE_B64", base64(artifact.agentCode()));
            env.put("REQUIREMENTS_B64", base64(artifact.requirements()));
            env.put("DOCKERFILE_B64", base64(artifact.dockerfile()));
        }

        if (credentials != null && credentials.credentials() != null) {
            AssumedCredentials assumed = credentials.credentials();
            env.put("AWS_ACCESS_KEY_ID", assumed.accessKeyId());
            env.put("AWS_SECRET_ACCESS_KEY", assumed.secretAccessKey());
            env.put("AWS_SESSION_TOKEN", assumed.sessionToken());
        }
        return env;
    }

    private List<String> readAllLogs(BackendHandle handle) {
        List<String> lines = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < MAX_LOG_PAGES; page++) {
            LogPage logPage = taskClient.readLogs(handle.taskId(), handle.logGroup(), handle.logStream(), cursor);
            lines.addAll(logPage.lines());
            if (logPage.isEmpty() || Objects.equals(logPage.nextCursor(), cursor)) {
                break;
            }
            cursor = logPage.nextCursor();
        }
        return lines;
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
    }

    private static void putIfPresent(Map<String, String> env, String key, String value) {
        if (value != null && !value.isBlank()) {
            env.put(key, value);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
