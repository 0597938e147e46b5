package com.agentbench.core.scheduler;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendRegistry;
import com.agentbench.backend.ExecutionBackend;
import com.agentbench.backend.JobDescriptor;
import com.agentbench.backend.PollResult;
import com.agentbench.core.collector.LogCollector;
import com.agentbench.core.error.AgentBenchException;
import com.agentbench.core.error.BackendNotFoundException;
import com.agentbench.core.error.ErrorStages;
import com.agentbench.core.error.IllegalTransitionException;
import com.agentbench.core.error.InfraException;
import com.agentbench.core.error.JobTimeoutException;
import com.agentbench.core.logging.MdcContext;
import com.agentbench.core.metrics.SchedulerMetrics;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.routing.CredentialContext;
import com.agentbench.core.routing.DeploymentRouter;
import com.agentbench.core.store.AgentStore;
import com.agentbench.core.store.JobStore;
import com.agentbench.core.store.QueueStore;
import com.agentbench.core.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Drives one claimed queue entry through the job lifecycle:
 * <pre>
 *   QUEUED -> [BUILDING] -> RUNNING -> COMPLETED | FAILED
 * </pre>
 * Failures before RUNNING go through {@link RetryPolicy}. Once the job is RUNNING the outcome is
 * final: a backend failure or the watchdog deadline fails the job without a retry.
 * <p>
 * The watchdog deadline is the claim time plus the job timeout plus the grace period. It is
 * checked against the injected {@link Clock} on every poll, independently of whatever timeout
 * the backend applies itself.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore jobs;
    private final QueueStore queue;
    private final AgentStore agents;
    private final UserStore users;
    private final BackendRegistry backends;
    private final DeploymentRouter router;
    private final JobStateMachine stateMachine;
    private final RetryPolicy retryPolicy;
    private final LogCollector collector;
    private final SchedulerMetrics metrics;
    private final SchedulerProperties properties;
    private final Executor dispatchExecutor;
    private final Clock clock;

    public JobRunner(JobStore jobs, QueueStore queue, AgentStore agents, UserStore users,
                     BackendRegistry backends, DeploymentRouter router, JobStateMachine stateMachine,
                     RetryPolicy retryPolicy, LogCollector collector, SchedulerMetrics metrics,
                     SchedulerProperties properties, @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                     Clock clock) {
        this.jobs = jobs;
        this.queue = queue;
        this.agents = agents;
        this.users = users;
        this.backends = backends;
        this.router = router;
        this.stateMachine = stateMachine;
        this.retryPolicy = retryPolicy;
        this.collector = collector;
        this.metrics = metrics;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    /**
     * Runs the claimed entry to a terminal outcome or back into the queue. Never throws.
     */
    public void run(QueueEntry claimed) {
        MdcContext.setWorker(properties.getWorkerId());
        try {
            Optional<Job> found = jobs.findById(claimed.jobId());
            if (found.isEmpty()) {
                log.warn("Queue entry {} references missing job {}", claimed.id(), claimed.jobId());
                queue.compareAndSet(claimed, claimed.abandoned("Job not found", false));
                return;
            }
            Job job = found.get();
            MdcContext.setJob(job);
            if (job.status().isTerminal()) {
                log.info("Job {} already finished as {}, dropping claim", job.id(), job.status());
                queue.compareAndSet(claimed, claimed.abandoned("Job already " + job.status(), false));
                return;
            }
            Instant deadline = claimed.claimedAt()
                    .plusMillis(job.timeoutMs())
                    .plusMillis(properties.getWatchdogGraceMs());
            ExecutionBackend backend = backends.forProvider(job.provider());

            BackendHandle handle = dispatch(claimed, job, backend, deadline);
            if (handle != null) {
                monitor(job, backend, handle, deadline);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected failure running queue entry {}: {}", claimed.id(), e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    // ── Dispatch ────────────────────────────────────────────────────────

    /**
     * Builds and submits the job and moves it to RUNNING.
     *
     * @return the backend handle, or null when the attempt ended before RUNNING
     */
    private BackendHandle dispatch(QueueEntry claimed, Job job, ExecutionBackend backend, Instant deadline) {
        BackendHandle handle = null;
        try {
            if (job.provider().requiresBuild()) {
                stateMachine.transition(job.id(), JobStatus.BUILDING);
            }
            collector.appendLog(job.id(), "Test claimed from queue by " + properties.getWorkerId()
                    + " (attempt " + (claimed.attempts() + 1) + "/" + retryPolicy.ceiling() + ")");

            Tier tier = users.findById(job.userId()).map(UserAccount::tier).orElse(Tier.FREEMIUM);
            String region = job.providerConfig() != null ? job.providerConfig().region() : null;
            CredentialContext credentials = router.resolveCredentials(job.userId(), tier, region);
            String runtimeId = agents.findById(job.agentId()).map(Agent::runtimeId).orElse(null);

            JobDescriptor descriptor = new JobDescriptor(job.id(), job.agentId(), job.query(), job.artifact(),
                    job.providerConfig(), runtimeId, job.timeoutMs(), credentials);
            collector.appendLog(job.id(), "Dispatching to " + backend.kind().tag() + " backend");
            BackendHandle submitted = submitWithin(backend, descriptor, deadline);
            handle = submitted;

            Job running = stateMachine.transition(job.id(), JobStatus.RUNNING, j -> j.toBuilder()
                    .infra(submitted.toInfraHandles())
                    .deploymentPackageRef(submitted.imageRef() != null ? submitted.imageRef() : j.deploymentPackageRef())
                    .metrics(submitted.buildTimeMs() > 0 ? j.metrics().withBuildTime(submitted.buildTimeMs()) : j.metrics())
                    .build());
            if (submitted.buildTimeMs() > 0) {
                metrics.recordBuildDuration(submitted.buildTimeMs());
            }
            if (running.metrics().queueWaitMs() != null) {
                metrics.recordQueueWait(running.metrics().queueWaitMs());
            }
            return submitted;
        } catch (IllegalTransitionException e) {
            // the job was cancelled while this worker was dispatching it
            log.info("Job {} changed under dispatch ({}), stopping", job.id(), e.getMessage());
            if (handle != null) {
                backend.cancel(handle);
            }
            queue.compareAndSet(claimed, claimed.abandoned(e.getMessage(), false));
            return null;
        } catch (AgentBenchException e) {
            failAttempt(claimed, e);
            return null;
        } catch (RuntimeException e) {
            failAttempt(claimed, new InfraException("Dispatch failed: " + e.getMessage(), e));
            return null;
        }
    }

    private BackendHandle submitWithin(ExecutionBackend backend, JobDescriptor descriptor, Instant deadline) {
        long remaining = Duration.between(clock.instant(), deadline).toMillis();
        if (remaining <= 0) {
            throw new JobTimeoutException("Deadline passed before the job could be submitted");
        }
        CompletableFuture<BackendHandle> future =
                CompletableFuture.supplyAsync(() -> backend.submit(descriptor), dispatchExecutor);
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new JobTimeoutException("Backend submit did not return within " + remaining + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfraException("Interrupted while submitting", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentBenchException abe) {
                throw abe;
            }
            throw new InfraException("Backend submit failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Applies the retry policy to a failed attempt. Also used for stale claims found by the
     * cleanup sweep.
     */
    void failAttempt(QueueEntry claimed, AgentBenchException failure) {
        String message = failure.getMessage();
        String jobId = claimed.jobId();
        RetryPolicy.Decision decision = retryPolicy.decide(claimed, failure);
        log.warn("Attempt {} of job {} failed [{}]: {} -> {}", claimed.attempts() + 1, jobId,
                failure.kind(), message, decision);
        try {
            switch (decision) {
                case RETRY -> {
                    // job first: a pending entry must never point at a job another worker cannot start
                    stateMachine.requeue(jobId, message);
                    queue.compareAndSet(claimed, claimed.requeued(message));
                    collector.appendLog(jobId, "Attempt " + (claimed.attempts() + 1) + " failed: " + message
                            + ". Requeued.");
                    metrics.recordRetry(failure.kind().name());
                }
                case ABANDON -> {
                    stateMachine.abandon(jobId, retryPolicy.abandonMessage(message), failure.stage());
                    queue.compareAndSet(claimed, claimed.abandoned(message, true));
                    metrics.recordJobResult(JobStatus.ABANDONED.name(), providerOf(jobId));
                }
                case FAIL -> {
                    stateMachine.fail(jobId, message, failure.stage() != null ? failure.stage() : ErrorStages.SERVICE);
                    queue.compareAndSet(claimed, claimed.abandoned(message, false));
                    metrics.recordJobResult(JobStatus.FAILED.name(), providerOf(jobId));
                }
            }
        } catch (IllegalTransitionException e) {
            log.info("Job {} finished elsewhere while handling its failure: {}", jobId, e.getMessage());
            queue.compareAndSet(claimed, claimed.abandoned(message, false));
        }
    }

    // ── Monitoring ──────────────────────────────────────────────────────

    private void monitor(Job job, ExecutionBackend backend, BackendHandle handle, Instant deadline) {
        String jobId = job.id();
        while (true) {
            if (!clock.instant().isBefore(deadline)) {
                expire(job, backend, handle);
                return;
            }
            Job current = jobs.findById(jobId).orElse(null);
            if (current == null || current.status().isTerminal()) {
                log.info("Job {} finished outside this worker, stopping", jobId);
                collector.finalDrain(jobId, backend, handle);
                return;
            }

            PollResult result;
            try {
                result = backend.poll(handle);
            } catch (BackendNotFoundException e) {
                collector.finalDrain(jobId, backend, handle);
                finish(job, () -> stateMachine.fail(jobId, e.getMessage(), ErrorStages.RUNTIME));
                return;
            } catch (AgentBenchException e) {
                log.warn("Poll of job {} failed, will retry: {}", jobId, e.getMessage());
                if (!pause()) {
                    return;
                }
                continue;
            }

            try {
                collector.drain(jobId, backend, handle);
            } catch (AgentBenchException e) {
                log.warn("Log drain of job {} failed: {}", jobId, e.getMessage());
            }

            switch (result.status()) {
                case SUCCEEDED -> {
                    collector.finalDrain(jobId, backend, handle);
                    finish(job, () -> stateMachine.complete(jobId, result.response(),
                            j -> j.toBuilder()
                                    .metrics(j.metrics().withResources(result.memoryUsedMb(), result.cpuUsed()))
                                    .build()));
                    return;
                }
                case FAILED -> {
                    collector.finalDrain(jobId, backend, handle);
                    String error = result.error() != null ? result.error() : "Backend reported failure";
                    finish(job, () -> stateMachine.fail(jobId, error, ErrorStages.RUNTIME));
                    return;
                }
                default -> {
                    if (!pause()) {
                        return;
                    }
                }
            }
        }
    }

    /**
     * Watchdog expiry: cancel best effort, then fail with stage {@code timeout}. Also used by the
     * sweep for RUNNING jobs no worker is tracking.
     */
    void expire(Job job, ExecutionBackend backend, BackendHandle handle) {
        log.warn("Job {} exceeded its timeout of {}ms plus {}ms grace, cancelling", job.id(), job.timeoutMs(),
                properties.getWatchdogGraceMs());
        metrics.recordWatchdogExpiry();
        backend.cancel(handle);
        collector.finalDrain(job.id(), backend, handle);
        finish(job, () -> stateMachine.fail(job.id(),
                "Test exceeded timeout of " + job.timeoutMs() + "ms", ErrorStages.TIMEOUT));
    }

    private void finish(Job job, Supplier<Job> transition) {
        try {
            Job done = transition.get();
            metrics.recordJobResult(done.status().name(), job.provider().tag());
            if (done.metrics().executionTimeMs() != null) {
                metrics.recordExecution(job.provider().tag(), done.metrics().executionTimeMs());
            }
        } catch (IllegalTransitionException e) {
            log.info("Job {} was finished concurrently: {}", job.id(), e.getMessage());
        }
    }

    /**
     * Sleeps one backend poll interval.
     *
     * @return false if the worker was interrupted, leaving the job to the watchdog sweep
     */
    private boolean pause() {
        try {
            Thread.sleep(properties.getBackendPollIntervalMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while monitoring, leaving the job to the watchdog sweep");
            return false;
        }
    }

    private String providerOf(String jobId) {
        return jobs.findById(jobId).map(j -> j.provider().tag()).orElse("unknown");
    }
}
