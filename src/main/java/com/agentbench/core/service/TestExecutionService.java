package com.agentbench.core.service;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendRegistry;
import com.agentbench.core.collector.LogCollector;
import com.agentbench.core.error.CancelledException;
import com.agentbench.core.error.IllegalTransitionException;
import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.UsageLimitExceededException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.events.JobEvent;
import com.agentbench.core.events.JobEventBus;
import com.agentbench.core.metrics.SchedulerMetrics;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobMetrics;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.routing.DeploymentRouter;
import com.agentbench.core.routing.RoutingPlan;
import com.agentbench.core.routing.TierProperties;
import com.agentbench.core.scheduler.JobStateMachine;
import com.agentbench.core.scheduler.SchedulerProperties;
import com.agentbench.core.store.AgentStore;
import com.agentbench.core.store.JobStore;
import com.agentbench.core.store.QueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for everything a user does with test jobs: submission, reads, cancellation, retry
 * and archival. The scheduler side of the lifecycle lives in
 * {@link com.agentbench.core.scheduler.QueueScheduler}.
 */
@Service
public class TestExecutionService {

    private static final Logger log = LoggerFactory.getLogger(TestExecutionService.class);

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;
    private static final int WAIT_SAMPLE_SIZE = 10;

    private final JobStore jobs;
    private final QueueStore queue;
    private final AgentStore agents;
    private final UserService users;
    private final DeploymentRouter router;
    private final TierProperties tiers;
    private final JobStateMachine stateMachine;
    private final LogCollector collector;
    private final BackendRegistry backends;
    private final SubmissionProperties submission;
    private final SchedulerProperties scheduler;
    private final SchedulerMetrics metrics;
    private final JobEventBus eventBus;
    private final Clock clock;

    public TestExecutionService(JobStore jobs, QueueStore queue, AgentStore agents, UserService users,
                                DeploymentRouter router, TierProperties tiers, JobStateMachine stateMachine,
                                LogCollector collector, BackendRegistry backends, SubmissionProperties submission,
                                SchedulerProperties scheduler, SchedulerMetrics metrics, JobEventBus eventBus,
                                Clock clock) {
        this.jobs = jobs;
        this.queue = queue;
        this.agents = agents;
        this.users = users;
        this.router = router;
        this.tiers = tiers;
        this.stateMachine = stateMachine;
        this.collector = collector;
        this.backends = backends;
        this.submission = submission;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    // ── Submission ──────────────────────────────────────────────────────

    /**
     * Validates, routes and queues a test. The job, its queue entry and any usage charge are
     * written together; when anything is rejected nothing is written.
     *
     * @param timeoutMs null for the default
     * @param priority  null for the default
     * @throws ValidationException                                     for bad input or an unknown agent
     * @throws UsageLimitExceededException                             when the monthly cap or concurrency limit is reached
     * @throws com.agentbench.core.error.NoAwsAccountConnectedException when the tier needs an account that is not connected
     */
    public SubmissionResult submitTest(String userId, String agentId, String query, Long timeoutMs, Integer priority) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Test query cannot be empty");
        }
        if (trimmed.length() > submission.getMaxQueryLength()) {
            throw new ValidationException("Test query too long (max " + submission.getMaxQueryLength() + " characters)");
        }
        long timeout = timeoutMs != null ? timeoutMs : submission.getDefaultTimeoutMs();
        if (timeout < submission.getMinTimeoutMs() || timeout > submission.getMaxTimeoutMs()) {
            throw new ValidationException("Timeout must be between " + submission.getMinTimeoutMs() + " and "
                    + submission.getMaxTimeoutMs() + " ms");
        }
        int effectivePriority = priority != null ? priority : submission.getDefaultPriority();
        if (effectivePriority < 1 || effectivePriority > 3) {
            throw new ValidationException("Priority must be 1, 2 or 3");
        }

        Agent agent = agents.findById(agentId)
                .orElseThrow(() -> new ValidationException("Agent not found: " + agentId));
        if (!agent.visibleTo(userId)) {
            throw new ValidationException("Not authorized to test agent " + agentId);
        }
        ExecutionArtifact artifact = agent.artifact() != null ? agent.artifact() : ExecutionArtifact.empty();
        checkSize("Agent code", artifact.agentCode(), submission.getMaxAgentCodeBytes());
        checkSize("Requirements", artifact.requirements(), submission.getMaxRequirementsBytes());
        checkSize("Dockerfile", artifact.dockerfile(), submission.getMaxDockerfileBytes());

        UserAccount user = users.getOrProvision(userId);
        RoutingPlan plan = router.plan(user, agent);

        int maxConcurrent = tiers.policyFor(user.tier()).getMaxConcurrentTests();

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        ProviderConfig providerConfig = agent.providerConfig() != null
                ? agent.providerConfig().withRegion(plan.region())
                : new ProviderConfig(null, null, plan.region());
        String jobId = UUID.randomUUID().toString();
        Job job = Job.builder()
                .id(jobId)
                .userId(userId)
                .agentId(agentId)
                .query(trimmed)
                .artifact(artifact)
                .provider(plan.provider())
                .providerConfig(providerConfig)
                .timeoutMs(timeout)
                .status(JobStatus.QUEUED)
                .logs(List.of("Test queued at priority " + effectivePriority + " for " + plan.provider().tag()))
                .submittedAt(now)
                .metrics(JobMetrics.empty())
                .build();
        QueueEntry entry = QueueEntry.pending(UUID.randomUUID().toString(), jobId, effectivePriority, now);

        try {
            jobs.submit(job, entry, plan.charge(), maxConcurrent);
        } catch (UsageLimitExceededException e) {
            metrics.recordUsageRejection(user.tier().value());
            throw e;
        }
        metrics.recordSubmission(plan.provider().tag());

        long position = queue.countPendingAhead(entry) + 1;
        long estimatedWait = position * submission.getSecondsPerQueuedJob();
        log.info("Queued job {} for agent {} (user {}, tier {}, provider {}, position {})",
                jobId, agentId, userId, user.tier().value(), plan.provider().tag(), position);
        eventBus.publish(new JobEvent(JobEvent.QUEUED, jobId,
                Map.of("priority", effectivePriority, "queuePosition", position), Instant.now(clock)));
        return new SubmissionResult(jobId, JobStatus.QUEUED, position, estimatedWait);
    }

    private static void checkSize(String what, String content, int maxBytes) {
        if (content != null && content.getBytes(StandardCharsets.UTF_8).length > maxBytes) {
            throw new ValidationException(what + " exceeds " + (maxBytes / 1024) + "KB");
        }
    }

    // ── Reads ───────────────────────────────────────────────────────────

    public Job getTestById(String jobId) {
        return jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException("Test", jobId));
    }

    /** Jobs of an agent, newest first. */
    public List<Job> getDeploymentHistory(String agentId, Integer limit) {
        return jobs.findByAgent(agentId, pageSize(limit));
    }

    public UserTestsPage getUserTests(String userId, Integer limit, JobStatus status) {
        int size = pageSize(limit);
        List<Job> found = jobs.findByUser(userId, status, size + 1);
        boolean hasMore = found.size() > size;
        return new UserTestsPage(hasMore ? found.subList(0, size) : found, hasMore);
    }

    public QueueStatus getQueueStatus() {
        long pending = queue.countPending();
        long running = jobs.countByStatus(EnumSet.of(JobStatus.BUILDING, JobStatus.RUNNING));
        long avgWait = Math.round(jobs.findRecentlyCompleted(WAIT_SAMPLE_SIZE).stream()
                .map(j -> j.metrics().queueWaitMs())
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0));
        long oldestAge = queue.oldestPendingCreatedAt()
                .map(created -> Math.max(0, Duration.between(created, clock.instant()).toMillis()))
                .orElse(0L);
        return new QueueStatus(pending, running, scheduler.getMaxConcurrent(), avgWait, oldestAge);
    }

    private static int pageSize(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(limit, MAX_PAGE_SIZE);
    }

    // ── Writes ──────────────────────────────────────────────────────────

    /**
     * Cancels a job. A queued job's entry is abandoned so no worker picks it up; an active job is
     * failed first and its backend work cancelled best effort. Cancellation never consumes a retry.
     *
     * @throws IllegalTransitionException if the job already finished
     */
    public Job cancelTest(String jobId, String userId) {
        Job job = getTestById(jobId);
        if (!job.userId().equals(userId)) {
            throw new ValidationException("Not authorized to cancel test " + jobId);
        }
        if (job.status().isTerminal()) {
            throw new IllegalTransitionException(jobId, job.status(), "finished tests cannot be cancelled");
        }

        CancelledException cancelled;
        if (job.status() == JobStatus.QUEUED) {
            queue.findByJobId(jobId)
                    .filter(e -> e.status() == QueueEntryStatus.PENDING)
                    .ifPresent(e -> queue.compareAndSet(e, e.abandoned("Cancelled by user", false)));
            cancelled = new CancelledException("Cancelled by user while queued");
        } else {
            cancelled = new CancelledException("Cancelled by user");
        }
        Job failed = stateMachine.fail(jobId, cancelled.getMessage(), cancelled.stage());
        collector.appendLog(jobId, cancelled.getMessage());

        if (job.infra() != null && backends.supports(job.provider())) {
            backends.forProvider(job.provider()).cancel(BackendHandle.fromInfra(job.provider(), job.infra()));
        }
        metrics.recordJobResult(JobStatus.FAILED.name(), job.provider().tag());
        log.info("Cancelled job {} (was {})", jobId, job.status());
        return failed;
    }

    /**
     * Resubmits a finished job, optionally with a new query, at the default priority.
     */
    public SubmissionResult retryTest(String jobId, String userId, String newQuery) {
        Job original = getTestById(jobId);
        if (!original.userId().equals(userId)) {
            throw new ValidationException("Not authorized to retry test " + jobId);
        }
        if (!original.status().isTerminal()) {
            throw new IllegalTransitionException(jobId, original.status(), "only finished tests can be retried");
        }
        String query = newQuery != null && !newQuery.isBlank() ? newQuery : original.query();
        log.info("Retrying job {} as a new submission", jobId);
        return submitTest(userId, original.agentId(), query, original.timeoutMs(), submission.getDefaultPriority());
    }

    public Job archiveTest(String jobId) {
        return stateMachine.transition(jobId, JobStatus.ARCHIVED);
    }

    /**
     * Status write with the usual side effects.
     *
     * @throws IllegalTransitionException if {@code status} is not a successor of the current status
     */
    public Job updateStatus(String jobId, JobStatus status, String error, String errorStage) {
        return stateMachine.updateStatus(jobId, status, error, errorStage);
    }

    public Job appendLogs(String jobId, List<String> lines) {
        return collector.appendLogs(jobId, lines);
    }
}
