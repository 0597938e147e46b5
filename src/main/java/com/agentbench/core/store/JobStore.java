package com.agentbench.core.store;

import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.QueueEntry;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Persisted job documents.
 */
public interface JobStore {

    /**
     * Creates a job and its queue entry in one transaction. When {@code charge} is non-null the
     * user's monthly usage is incremented in the same transaction, guarded by the charge cap.
     * When {@code maxUnfinished} is positive the user's unfinished jobs are counted in that
     * transaction too, serialized per user, and the submission is refused once they reach it.
     *
     * @throws com.agentbench.core.error.UsageLimitExceededException if the monthly cap or the
     *         concurrency limit is already reached; nothing is written in that case
     */
    Job submit(Job job, QueueEntry entry, UsageCharge charge, int maxUnfinished);

    /** {@link #submit(Job, QueueEntry, UsageCharge, int)} without a concurrency limit. */
    default Job submit(Job job, QueueEntry entry, UsageCharge charge) {
        return submit(job, entry, charge, 0);
    }

    Optional<Job> findById(String jobId);

    /**
     * Atomically replaces the job with {@code change.apply(current)}. The function may be invoked
     * more than once when a concurrent writer wins, so it must be free of side effects.
     * Returning the same instance leaves the stored document untouched.
     *
     * @throws com.agentbench.core.error.JobNotFoundException if no such job exists
     */
    Job update(String jobId, UnaryOperator<Job> change);

    /** Jobs of an agent, newest first. */
    List<Job> findByAgent(String agentId, int limit);

    /** Jobs of a user, newest first, optionally filtered by status. */
    List<Job> findByUser(String userId, JobStatus status, int limit);

    List<Job> findByStatus(JobStatus status);

    /** Completed jobs ordered by completion time, most recent first. */
    List<Job> findRecentlyCompleted(int limit);

    long countByStatus(Set<JobStatus> statuses);

    /** Jobs of the user that have not reached a terminal status. */
    long countUnfinishedByUser(String userId);
}
