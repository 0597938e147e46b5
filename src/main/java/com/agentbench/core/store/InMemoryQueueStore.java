package com.agentbench.core.store;

import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link QueueStore}. Conditional updates run under the store monitor, which gives the
 * same single-document atomicity the JDBC store gets from its guarded UPDATE.
 */
public class InMemoryQueueStore implements QueueStore {

    static final Comparator<QueueEntry> SELECTION_ORDER = Comparator
            .comparingInt(QueueEntry::priority)
            .thenComparing(QueueEntry::createdAt)
            .thenComparing(QueueEntry::id);

    private final ConcurrentHashMap<String, QueueEntry> entries = new ConcurrentHashMap<>();

    synchronized void insert(QueueEntry entry) {
        if (entries.putIfAbsent(entry.id(), entry) != null) {
            throw new IllegalStateException("Queue entry already exists: " + entry.id());
        }
    }

    @Override
    public List<QueueEntry> findPending(int limit) {
        return entries.values().stream()
                .filter(e -> e.status() == QueueEntryStatus.PENDING)
                .sorted(SELECTION_ORDER)
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<QueueEntry> findById(String entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public Optional<QueueEntry> findByJobId(String jobId) {
        return entries.values().stream().filter(e -> e.jobId().equals(jobId)).findFirst();
    }

    @Override
    public synchronized boolean tryClaim(String entryId, QueueEntryStatus expectedStatus, int expectedAttempts,
                                         String workerId, Instant claimedAt) {
        QueueEntry current = entries.get(entryId);
        if (current == null || current.status() != expectedStatus || current.attempts() != expectedAttempts) {
            return false;
        }
        entries.put(entryId, current.claimed(workerId, claimedAt));
        return true;
    }

    @Override
    public synchronized boolean compareAndSet(QueueEntry expected, QueueEntry replacement) {
        QueueEntry current = entries.get(expected.id());
        if (current == null || current.status() != expected.status() || current.attempts() != expected.attempts()) {
            return false;
        }
        entries.put(expected.id(), replacement);
        return true;
    }

    @Override
    public List<QueueEntry> findClaimedBefore(Instant cutoff) {
        return entries.values().stream()
                .filter(e -> e.status() == QueueEntryStatus.CLAIMED)
                .filter(e -> e.claimedAt() != null && e.claimedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public long countPending() {
        return entries.values().stream().filter(e -> e.status() == QueueEntryStatus.PENDING).count();
    }

    @Override
    public long countPendingAhead(QueueEntry entry) {
        return entries.values().stream()
                .filter(e -> e.status() == QueueEntryStatus.PENDING)
                .filter(e -> SELECTION_ORDER.compare(e, entry) < 0)
                .count();
    }

    @Override
    public Optional<Instant> oldestPendingCreatedAt() {
        return entries.values().stream()
                .filter(e -> e.status() == QueueEntryStatus.PENDING)
                .map(QueueEntry::createdAt)
                .min(Comparator.naturalOrder());
    }
}
