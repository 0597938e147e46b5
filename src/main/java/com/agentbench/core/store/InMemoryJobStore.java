package com.agentbench.core.store;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.UsageLimitExceededException;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.QueueEntry;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Map-backed {@link JobStore}. Submissions lock the user store so the concurrency check, the usage
 * charge, the job and its queue entry become visible together.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparing(Job::submittedAt, Comparator.nullsLast(Comparator.naturalOrder())).reversed();

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final InMemoryQueueStore queueStore;
    private final InMemoryUserStore userStore;

    public InMemoryJobStore(InMemoryQueueStore queueStore, InMemoryUserStore userStore) {
        this.queueStore = queueStore;
        this.userStore = userStore;
    }

    @Override
    public Job submit(Job job, QueueEntry entry, UsageCharge charge, int maxUnfinished) {
        synchronized (userStore) {
            if (jobs.containsKey(job.id())) {
                throw new IllegalStateException("Job already exists: " + job.id());
            }
            if (maxUnfinished > 0 && countUnfinishedByUser(job.userId()) >= maxUnfinished) {
                throw UsageLimitExceededException.concurrent(maxUnfinished);
            }
            if (charge != null && !userStore.tryIncrementUsage(charge.userId(), charge.monthlyCap())) {
                throw new UsageLimitExceededException(
                        "Monthly test limit of " + charge.monthlyCap() + " reached for user " + charge.userId());
            }
            jobs.put(job.id(), job);
            queueStore.insert(entry);
            return job;
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Job update(String jobId, UnaryOperator<Job> change) {
        Job updated = jobs.computeIfPresent(jobId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new JobNotFoundException("Job", jobId);
        }
        return updated;
    }

    @Override
    public List<Job> findByAgent(String agentId, int limit) {
        return jobs.values().stream()
                .filter(j -> j.agentId().equals(agentId))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public List<Job> findByUser(String userId, JobStatus status, int limit) {
        return jobs.values().stream()
                .filter(j -> j.userId().equals(userId))
                .filter(j -> status == null || j.status() == status)
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return jobs.values().stream().filter(j -> j.status() == status).toList();
    }

    @Override
    public List<Job> findRecentlyCompleted(int limit) {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.COMPLETED && j.completedAt() != null)
                .sorted(Comparator.comparing(Job::completedAt, Comparator.<Instant>reverseOrder()))
                .limit(limit)
                .toList();
    }

    @Override
    public long countByStatus(Set<JobStatus> statuses) {
        return jobs.values().stream().filter(j -> statuses.contains(j.status())).count();
    }

    @Override
    public long countUnfinishedByUser(String userId) {
        return jobs.values().stream()
                .filter(j -> j.userId().equals(userId) && !j.status().isTerminal())
                .count();
    }
}
