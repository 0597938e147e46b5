package com.agentbench.core.store;

import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted queue entries. Entries are inserted by {@link JobStore#submit}.
 */
public interface QueueStore {

    /** Pending entries in selection order: priority ascending, then createdAt ascending. */
    List<QueueEntry> findPending(int limit);

    Optional<QueueEntry> findById(String entryId);

    Optional<QueueEntry> findByJobId(String jobId);

    /**
     * Compare-and-set {@code expectedStatus -> claimed}, guarded by equality on the entry's
     * current status and attempt count.
     *
     * @return true if this caller won the claim
     */
    boolean tryClaim(String entryId, QueueEntryStatus expectedStatus, int expectedAttempts,
                     String workerId, Instant claimedAt);

    /**
     * Replaces {@code expected} with {@code replacement} if the stored entry still has the same
     * status and attempt count as {@code expected}.
     */
    boolean compareAndSet(QueueEntry expected, QueueEntry replacement);

    /** Claimed entries whose claim started before {@code cutoff}. */
    List<QueueEntry> findClaimedBefore(Instant cutoff);

    long countPending();

    /** Pending entries that would be selected before the given one. */
    long countPendingAhead(QueueEntry entry);

    Optional<Instant> oldestPendingCreatedAt();
}
