package com.agentbench.backend.runtime;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendStatus;
import com.agentbench.backend.ExecutionBackend;
import com.agentbench.backend.JobDescriptor;
import com.agentbench.backend.LogPage;
import com.agentbench.backend.PollResult;
import com.agentbench.core.error.BackendNotFoundException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * Managed-runtime path: invoke a hosted agent runtime by reference id.
 * <p>
 * In {@link Mode#ASYNC} the runtime hands back an invocation id that is polled remotely. In
 * {@link Mode#SYNC} the blocking invocation runs on this backend's executor and {@link #poll}
 * observes the local future, so the scheduler sees the same submit/poll shape either way.
 * Synchronous invocations are tracked in memory only; after a restart their handles poll as
 * not found.
 */
public class ManagedRuntimeBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(ManagedRuntimeBackend.class);

    private static final Duration FINISHED_RETENTION = Duration.ofMinutes(30);

    public enum Mode {
        SYNC,
        ASYNC;

        public static Mode fromValue(String value) {
            return valueOf(value.trim().toUpperCase());
        }
    }

    private final RuntimeClient client;
    private final Mode mode;
    private final ExecutorService executor;
    private final Clock clock;
    private final Map<String, TrackedInvocation> local = new ConcurrentHashMap<>();

    public ManagedRuntimeBackend(RuntimeClient client, Mode mode, ExecutorService executor, Clock clock) {
        this.client = client;
        this.mode = mode;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.MANAGED_RUNTIME;
    }

    @Override
    public BackendHandle submit(JobDescriptor descriptor) {
        String runtimeId = descriptor.runtimeId();
        if (runtimeId == null || runtimeId.isBlank()) {
            throw new ValidationException("Agent " + descriptor.agentId() + " has no managed runtime id");
        }
        ProviderConfig config = descriptor.providerConfig();
        String region = config != null && config.region() != null
                ? config.region()
                : descriptor.credentials() != null ? descriptor.credentials().region() : null;
        var payload = new RuntimeClient.Payload(descriptor.query(),
                config != null ? config.modelId() : null, region, descriptor.timeoutMs());
        String sessionId = "session-" + descriptor.jobId();

        if (mode == Mode.ASYNC) {
            String invocationId = client.startInvocation(runtimeId, sessionId, payload);
            return handle(invocationId, runtimeId, sessionId);
        }

        purgeFinished();
        String invocationId = UUID.randomUUID().toString();
        TrackedInvocation tracked = new TrackedInvocation();
        tracked.logs.add("Invoking runtime " + runtimeId + " (session " + sessionId + ")");
        // poll observes the dependent stage so the logs are in place once it reports done
        tracked.future = CompletableFuture.supplyAsync(
                () -> client.invoke(runtimeId, sessionId, payload), executor)
                .whenComplete((result, error) -> {
                    if (result != null) {
                        tracked.logs.addAll(result.logs());
                    }
                    tracked.finishedAt = clock.instant();
                });
        local.put(invocationId, tracked);
        log.info("Invoking runtime {} for job {} (invocation {})", runtimeId, descriptor.jobId(), invocationId);
        return handle(invocationId, runtimeId, sessionId);
    }

    @Override
    public PollResult poll(BackendHandle handle) {
        if (mode == Mode.ASYNC) {
            return toPollResult(client.getInvocation(handle.taskArn(), handle.taskId()));
        }
        TrackedInvocation tracked = tracked(handle);
        CompletableFuture<RuntimeClient.Invocation> future = tracked.future;
        if (!future.isDone()) {
            return PollResult.running(List.of());
        }
        if (future.isCancelled()) {
            return PollResult.failed("Invocation cancelled");
        }
        try {
            return toPollResult(future.join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return PollResult.failed("Runtime invocation failed: " + cause.getMessage());
        }
    }

    @Override
    public void cancel(BackendHandle handle) {
        if (mode == Mode.SYNC) {
            TrackedInvocation tracked = local.get(handle.taskId());
            if (tracked != null) {
                tracked.future.cancel(true);
            }
        }
        try {
            client.stopInvocation(handle.taskArn(), handle.taskId());
        } catch (Exception e) {
            log.warn("Failed to stop invocation {} on runtime {}: {}", handle.taskId(), handle.taskArn(), e.getMessage());
        }
    }

    @Override
    public LogPage fetchLogs(BackendHandle handle, String cursor) {
        List<String> all = mode == Mode.ASYNC
                ? client.getInvocation(handle.taskArn(), handle.taskId()).logs()
                : new ArrayList<>(tracked(handle).logs);
        int offset = cursor == null ? 0 : Integer.parseInt(cursor);
        if (offset >= all.size()) {
            return LogPage.empty(cursor);
        }
        return new LogPage(all.subList(offset, all.size()), String.valueOf(all.size()));
    }

    // ── Internals ────────────────────────────────────────────────────────

    private static final class TrackedInvocation {
        private volatile CompletableFuture<RuntimeClient.Invocation> future;
        private final List<String> logs = new CopyOnWriteArrayList<>();
        private volatile Instant finishedAt;
    }

    private BackendHandle handle(String invocationId, String runtimeId, String sessionId) {
        return new BackendHandle(ProviderKind.MANAGED_RUNTIME, invocationId, runtimeId, null, sessionId, null, 0L);
    }

    private TrackedInvocation tracked(BackendHandle handle) {
        TrackedInvocation tracked = local.get(handle.taskId());
        if (tracked == null) {
            throw new BackendNotFoundException("Invocation not tracked by this process: " + handle.taskId());
        }
        return tracked;
    }

    private void purgeFinished() {
        Instant cutoff = clock.instant().minus(FINISHED_RETENTION);
        local.entrySet().removeIf(e -> e.getValue().finishedAt != null && e.getValue().finishedAt.isBefore(cutoff));
    }

    /** A missing status means the runtime has not reported yet; the watchdog bounds the wait. */
    static PollResult toPollResult(RuntimeClient.Invocation invocation) {
        BackendStatus status = switch (Objects.requireNonNullElse(invocation.status(), "pending").toLowerCase()) {
            case "pending", "queued" -> BackendStatus.PENDING;
            case "running", "in_progress" -> BackendStatus.RUNNING;
            case "succeeded", "completed", "success" -> BackendStatus.SUCCEEDED;
            default -> BackendStatus.FAILED;
        };
        return switch (status) {
            case PENDING -> PollResult.pending();
            case RUNNING -> PollResult.running(invocation.logs());
            case SUCCEEDED -> PollResult.succeeded(invocation.response());
            case FAILED -> PollResult.failed(invocation.error() != null
                    ? invocation.error() : "Runtime reported status " + invocation.status());
        };
    }
}
