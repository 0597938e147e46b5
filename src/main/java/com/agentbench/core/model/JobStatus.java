package com.agentbench.core.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a test job.
 * <p>
 * Transitions are only legal along the edges returned by {@link #successors()}.
 * {@link #ARCHIVED} is an administrative state reachable from any finished status.
 */
public enum JobStatus {
    CREATED,
    QUEUED,
    BUILDING,
    RUNNING,
    COMPLETED,
    FAILED,
    ABANDONED,
    ARCHIVED;

    private static final Map<JobStatus, Set<JobStatus>> EDGES = Map.of(
            CREATED, EnumSet.of(QUEUED),
            // QUEUED -> QUEUED re-enters the queue after a retryable failure before RUNNING
            QUEUED, EnumSet.of(QUEUED, BUILDING, RUNNING, FAILED, ABANDONED),
            BUILDING, EnumSet.of(RUNNING, QUEUED, FAILED),
            RUNNING, EnumSet.of(COMPLETED, FAILED),
            COMPLETED, EnumSet.of(ARCHIVED),
            FAILED, EnumSet.of(ARCHIVED),
            ABANDONED, EnumSet.of(ARCHIVED),
            ARCHIVED, EnumSet.noneOf(JobStatus.class)
    );

    public Set<JobStatus> successors() {
        return EDGES.get(this);
    }

    public boolean canTransitionTo(JobStatus next) {
        return EDGES.get(this).contains(next);
    }

    /** True once the job has finished, successfully or not. ARCHIVED counts as finished. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABANDONED || this == ARCHIVED;
    }

    /** True while a backend may be doing work for the job. */
    public boolean isActive() {
        return this == BUILDING || this == RUNNING;
    }

    /** Statuses for which {@code error} and {@code errorStage} must be set. */
    public boolean carriesError() {
        return this == FAILED || this == ABANDONED;
    }

    public JobPhase phase() {
        return switch (this) {
            case CREATED, QUEUED -> JobPhase.QUEUED;
            case BUILDING -> JobPhase.BUILDING;
            case RUNNING -> JobPhase.RUNNING;
            case COMPLETED, FAILED, ABANDONED, ARCHIVED -> JobPhase.COMPLETED;
        };
    }
}
