package com.agentbench.core.scheduler;

import com.agentbench.core.error.ErrorStages;
import com.agentbench.core.error.IllegalTransitionException;
import com.agentbench.core.events.JobEvent;
import com.agentbench.core.events.JobEventBus;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobResult;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Applies status changes to stored jobs.
 * <p>
 * Every change goes through {@link JobStore#update}, so a transition is validated against the
 * status actually stored at write time, not a stale snapshot. Side effects of each transition:
 * <ul>
 *   <li>leaving the queue for the first time sets {@code startedAt} and the queue-wait metric</li>
 *   <li>a terminal status sets {@code completedAt}, the success flag and the execution time</li>
 *   <li>FAILED and ABANDONED always carry an error and an error stage</li>
 *   <li>going back to QUEUED drops the infra handles of the failed attempt</li>
 * </ul>
 * Successful changes are published as {@link JobEvent#STATUS} events.
 */
@Component
public class JobStateMachine {

    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);

    private final JobStore jobs;
    private final JobEventBus eventBus;
    private final Clock clock;

    public JobStateMachine(JobStore jobs, JobEventBus eventBus, Clock clock) {
        this.jobs = jobs;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Job transition(String jobId, JobStatus to) {
        return transition(jobId, to, UnaryOperator.identity());
    }

    /**
     * Moves the job to {@code to} and then applies {@code extra} to the result, in one update.
     */
    public Job transition(String jobId, JobStatus to, UnaryOperator<Job> extra) {
        Instant now = now();
        return publish(jobs.update(jobId, job -> extra.apply(apply(job, to, null, null, null, now))));
    }

    public Job complete(String jobId, String response, UnaryOperator<Job> extra) {
        Instant now = now();
        return publish(jobs.update(jobId,
                job -> extra.apply(apply(job, JobStatus.COMPLETED, response, null, null, now))));
    }

    public Job fail(String jobId, String error, String errorStage) {
        Instant now = now();
        return publish(jobs.update(jobId, job -> apply(job, JobStatus.FAILED, null, error, errorStage, now)));
    }

    /**
     * Puts the job back in the queue after a failed attempt. BUILDING reverts to QUEUED, a job
     * that never left QUEUED stays there.
     */
    public Job requeue(String jobId, String error) {
        Instant now = now();
        log.info("Requeueing job {} after: {}", jobId, error);
        return publish(jobs.update(jobId, job -> apply(job, JobStatus.QUEUED, null, null, null, now)));
    }

    /**
     * Abandons a job whose entry hit the retry ceiling. A job caught in BUILDING passes through
     * QUEUED first, since ABANDONED is only reachable from there.
     */
    public Job abandon(String jobId, String error, String errorStage) {
        Instant now = now();
        return publish(jobs.update(jobId, job -> {
            Job queued = job.status() == JobStatus.QUEUED ? job : apply(job, JobStatus.QUEUED, null, null, null, now);
            return apply(queued, JobStatus.ABANDONED, null, error, errorStage, now);
        }));
    }

    /**
     * Generic status write used by the internal status endpoint.
     */
    public Job updateStatus(String jobId, JobStatus to, String error, String errorStage) {
        Instant now = now();
        if (to == JobStatus.ABANDONED) {
            return abandon(jobId, error, errorStage);
        }
        return publish(jobs.update(jobId, job -> apply(job, to, null, error, errorStage, now)));
    }

    /**
     * Pure transition function.
     *
     * @throws IllegalTransitionException if {@code to} is not a successor of the job's status
     */
    static Job apply(Job job, JobStatus to, String response, String error, String errorStage, Instant now) {
        JobStatus from = job.status();
        if (!from.canTransitionTo(to)) {
            throw new IllegalTransitionException(job.id(), from, to);
        }
        Job.Builder next = job.toBuilder().status(to);

        if (to.isActive() && job.startedAt() == null) {
            next.startedAt(now);
            if (job.submittedAt() != null) {
                next.metrics(job.metrics().withQueueWait(millisBetween(job.submittedAt(), now)));
            }
        }
        switch (to) {
            case QUEUED -> {
                next.infra(null);
                next.result(JobResult.pending());
            }
            case COMPLETED -> {
                next.result(JobResult.succeeded(response));
                finish(job, next, now);
            }
            case FAILED, ABANDONED -> {
                next.result(JobResult.failed(
                        error != null ? error : "Unknown error",
                        errorStage != null ? errorStage : ErrorStages.SERVICE));
                finish(job, next, now);
            }
            case ARCHIVED -> {
                // error fields belong to FAILED and ABANDONED only
                JobResult outcome = job.result();
                next.result(new JobResult(outcome.success(), outcome.response(), null, null));
            }
            default -> {
            }
        }
        return next.build();
    }

    private static void finish(Job job, Job.Builder next, Instant now) {
        next.completedAt(now);
        if (job.startedAt() != null) {
            next.metrics(job.metrics().withExecutionTime(millisBetween(job.startedAt(), now)));
        }
    }

    private static long millisBetween(Instant from, Instant to) {
        return Math.max(0, Duration.between(from, to).toMillis());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private Job publish(Job job) {
        log.info("Job {} is now {}", job.id(), job.status());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", job.status().name());
        payload.put("phase", job.phase().value());
        if (job.result().error() != null) {
            payload.put("error", job.result().error());
            payload.put("errorStage", job.result().errorStage());
        }
        eventBus.publish(new JobEvent(JobEvent.STATUS, job.id(), payload, Instant.now(clock)));
        return job;
    }
}
