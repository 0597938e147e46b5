package com.agentbench.core.service;

/**
 * Snapshot of queue load.
 *
 * @param pendingCount       entries waiting to be claimed
 * @param runningCount       jobs BUILDING or RUNNING
 * @param capacity           concurrency cap across workers
 * @param avgWaitMs          mean queue wait of the last completed jobs, 0 when none
 * @param oldestPendingAgeMs age of the oldest pending entry, 0 when the queue is empty
 */
public record QueueStatus(long pendingCount, long runningCount, int capacity, long avgWaitMs, long oldestPendingAgeMs) {
}
