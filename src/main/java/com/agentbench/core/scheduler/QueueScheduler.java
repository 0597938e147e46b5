package com.agentbench.core.scheduler;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendRegistry;
import com.agentbench.core.error.ClaimConflictException;
import com.agentbench.core.error.StaleClaimException;
import com.agentbench.core.events.JobEvent;
import com.agentbench.core.events.JobEventBus;
import com.agentbench.core.metrics.SchedulerMetrics;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;
import com.agentbench.core.store.JobStore;
import com.agentbench.core.store.QueueStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The claim/dispatch loop.
 * <p>
 * Each tick selects pending entries in priority and age order and claims them one at a time with
 * a compare-and-set on the entry. A lost race re-selects instead of failing. Claimed entries are
 * handed to the worker pool, so the lifecycle of one job never blocks the claiming of the next.
 * Ticks run periodically, and on demand whenever a job is queued.
 * <p>
 * Two maintenance sweeps run alongside: stale claims (claimed longer than the claim timeout
 * without starting) are treated as a failed attempt, and RUNNING jobs that no local worker
 * tracks are failed once their watchdog deadline has passed.
 */
@Service
public class QueueScheduler {

    private static final Logger log = LoggerFactory.getLogger(QueueScheduler.class);

    private static final Set<JobStatus> IN_FLIGHT = EnumSet.of(JobStatus.BUILDING, JobStatus.RUNNING);

    private final QueueStore queue;
    private final JobStore jobs;
    private final JobRunner runner;
    private final BackendRegistry backends;
    private final SchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final JobEventBus eventBus;
    private final Executor workers;
    private final Clock clock;

    /** Jobs whose lifecycle is being driven by this process. */
    private final Set<String> tracked = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private JobEventBus.Subscription trigger;

    public QueueScheduler(QueueStore queue, JobStore jobs, JobRunner runner, BackendRegistry backends,
                          SchedulerProperties properties, SchedulerMetrics metrics, JobEventBus eventBus,
                          @Qualifier("schedulerWorkers") Executor workers, Clock clock) {
        this.queue = queue;
        this.jobs = jobs;
        this.runner = runner;
        this.backends = backends;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.workers = workers;
        this.clock = clock;
    }

    @PostConstruct
    void registerTrigger() {
        if (!properties.isEnabled()) {
            return;
        }
        trigger = eventBus.subscribeToType(JobEvent.QUEUED, event -> requestTick());
    }

    // ── Claim and dispatch ──────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${agentbench.scheduler.poll-interval-ms:5000}")
    public void tick() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            processQueue();
        } catch (RuntimeException e) {
            log.error("Queue tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Asks for an immediate tick without waiting for the next periodic one.
     */
    public void requestTick() {
        try {
            workers.execute(this::tick);
        } catch (RejectedExecutionException e) {
            log.debug("On-demand tick rejected: {}", e.getMessage());
        }
    }

    /**
     * Claims up to {@code min(claimBatchSize, maxConcurrent - inFlight)} entries and dispatches
     * them to the worker pool.
     *
     * @return number of entries claimed by this call
     */
    public int processQueue() {
        if (!accepting.get()) {
            return 0;
        }
        long inFlight = Math.max(jobs.countByStatus(IN_FLIGHT), tracked.size());
        int slots = (int) Math.min(properties.getClaimBatchSize(), properties.getMaxConcurrent() - inFlight);
        if (slots <= 0) {
            log.debug("At capacity ({}/{}), skipping tick", inFlight, properties.getMaxConcurrent());
            return 0;
        }

        int claimed = 0;
        Set<String> seen = new HashSet<>();
        while (claimed < slots) {
            Optional<QueueEntry> candidate = queue.findPending(slots - claimed + seen.size()).stream()
                    .filter(e -> !seen.contains(e.id()))
                    .findFirst();
            if (candidate.isEmpty()) {
                break;
            }
            QueueEntry entry = candidate.get();
            seen.add(entry.id());
            try {
                dispatch(claim(entry));
                claimed++;
            } catch (ClaimConflictException e) {
                metrics.recordClaimConflict();
                log.debug("{}; re-selecting", e.getMessage());
            }
        }
        if (claimed > 0) {
            log.info("Claimed {} queue entr{} ({} in flight before tick)", claimed, claimed == 1 ? "y" : "ies", inFlight);
        }
        return claimed;
    }

    /**
     * Compare-and-set {@code pending -> claimed} on the entry as it was selected.
     *
     * @throws ClaimConflictException if another worker changed the entry first
     */
    QueueEntry claim(QueueEntry candidate) {
        Instant now = clock.instant();
        if (!queue.tryClaim(candidate.id(), QueueEntryStatus.PENDING, candidate.attempts(),
                properties.getWorkerId(), now)) {
            throw new ClaimConflictException(candidate.id());
        }
        metrics.recordClaim();
        return candidate.claimed(properties.getWorkerId(), now);
    }

    private void dispatch(QueueEntry claimed) {
        tracked.add(claimed.jobId());
        try {
            workers.execute(() -> {
                try {
                    runner.run(claimed);
                } finally {
                    tracked.remove(claimed.jobId());
                }
            });
        } catch (RejectedExecutionException e) {
            tracked.remove(claimed.jobId());
            log.warn("Worker pool rejected job {}, releasing its claim", claimed.jobId());
            queue.compareAndSet(claimed, claimed.released());
        }
    }

    // ── Maintenance ─────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${agentbench.scheduler.cleanup-interval-ms:60000}")
    public void maintenance() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            cleanupStaleClaims();
            sweepWatchdog();
        } catch (RuntimeException e) {
            log.error("Scheduler maintenance failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Treats claims older than the claim timeout whose job never reached RUNNING as a failed,
     * retryable attempt.
     *
     * @return number of entries requeued or abandoned
     */
    public int cleanupStaleClaims() {
        Instant cutoff = clock.instant().minusMillis(properties.getClaimTimeoutMs());
        int cleaned = 0;
        for (QueueEntry entry : queue.findClaimedBefore(cutoff)) {
            if (tracked.contains(entry.jobId())) {
                continue;
            }
            Optional<Job> job = jobs.findById(entry.jobId());
            if (job.isEmpty()) {
                queue.compareAndSet(entry, entry.abandoned("Job not found", false));
                continue;
            }
            JobStatus status = job.get().status();
            if (status != JobStatus.QUEUED && status != JobStatus.BUILDING) {
                continue;
            }
            log.info("Cleaning up stale claim {} on job {} (claimed by {} at {})",
                    entry.id(), entry.jobId(), entry.claimedBy(), entry.claimedAt());
            runner.failAttempt(entry, new StaleClaimException("Test abandoned - claimed but never started"));
            cleaned++;
        }
        return cleaned;
    }

    /**
     * Fails RUNNING jobs past their watchdog deadline that no local worker is monitoring, for
     * example because the worker that started them died.
     *
     * @return number of jobs expired
     */
    public int sweepWatchdog() {
        Instant now = clock.instant();
        int expired = 0;
        for (Job job : jobs.findByStatus(JobStatus.RUNNING)) {
            if (tracked.contains(job.id()) || job.infra() == null) {
                continue;
            }
            Instant startedAt = queue.findByJobId(job.id())
                    .map(QueueEntry::claimedAt)
                    .orElse(job.startedAt());
            if (startedAt == null) {
                continue;
            }
            Instant deadline = startedAt.plusMillis(job.timeoutMs()).plusMillis(properties.getWatchdogGraceMs());
            if (now.isBefore(deadline)) {
                continue;
            }
            var backend = backends.forProvider(job.provider());
            runner.expire(job, backend, BackendHandle.fromInfra(job.provider(), job.infra()));
            expired++;
        }
        return expired;
    }

    public boolean isTracked(String jobId) {
        return tracked.contains(jobId);
    }

    public int trackedCount() {
        return tracked.size();
    }

    // ── Shutdown ────────────────────────────────────────────────────────

    /**
     * Stops claiming and waits up to the drain timeout for in-flight lifecycles to finish.
     * Jobs still running afterwards are left to the watchdog sweep of another worker.
     */
    @PreDestroy
    public void shutdown() {
        accepting.set(false);
        if (trigger != null) {
            trigger.unsubscribe();
        }
        if (!(workers instanceof ExecutorService pool)) {
            return;
        }
        log.info("Draining {} in-flight job(s)", tracked.size());
        pool.shutdown();
        try {
            if (!pool.awaitTermination(properties.getDrainTimeoutSeconds(), TimeUnit.SECONDS)) {
                List<Runnable> dropped = pool.shutdownNow();
                log.warn("Drain timed out with {} job(s) still running and {} not started", tracked.size(),
                        dropped.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
