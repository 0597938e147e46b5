package com.agentbench.core.model;

/**
 * Coarse projection of {@link JobStatus} shown to users.
 */
public enum JobPhase {
    QUEUED,
    BUILDING,
    RUNNING,
    COMPLETED;

    public String value() {
        return name().toLowerCase();
    }
}
