package com.agentbench.core.model;

import java.time.Instant;

/**
 * Queue record pointing at a {@link Job}. Created together with the job and outlived by it.
 *
 * @param id        entry id
 * @param jobId     referenced job
 * @param priority  1 (high) to 3 (low)
 * @param status    pending, claimed or abandoned
 * @param createdAt enqueue time; FIFO key within a priority class
 * @param claimedAt time of the current claim, null unless claimed
 * @param claimedBy worker holding the current claim, null unless claimed
 * @param attempts  failed attempts so far
 * @param lastError message of the last failed attempt
 */
public record QueueEntry(
        String id,
        String jobId,
        int priority,
        QueueEntryStatus status,
        Instant createdAt,
        Instant claimedAt,
        String claimedBy,
        int attempts,
        String lastError
) {

    public static QueueEntry pending(String id, String jobId, int priority, Instant createdAt) {
        return new QueueEntry(id, jobId, priority, QueueEntryStatus.PENDING, createdAt, null, null, 0, null);
    }

    public QueueEntry claimed(String workerId, Instant at) {
        return new QueueEntry(id, jobId, priority, QueueEntryStatus.CLAIMED, createdAt, at, workerId, attempts, lastError);
    }

    /** Back to pending after a failed attempt; attempts is incremented. */
    public QueueEntry requeued(String error) {
        return new QueueEntry(id, jobId, priority, QueueEntryStatus.PENDING, createdAt, null, null, attempts + 1, error);
    }

    /** Back to pending without counting an attempt, for claims this worker could not start. */
    public QueueEntry released() {
        return new QueueEntry(id, jobId, priority, QueueEntryStatus.PENDING, createdAt, null, null, attempts, lastError);
    }

    public QueueEntry abandoned(String error, boolean countAttempt) {
        return new QueueEntry(id, jobId, priority, QueueEntryStatus.ABANDONED, createdAt, claimedAt, claimedBy,
                countAttempt ? attempts + 1 : attempts, error);
    }
}
