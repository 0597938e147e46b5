package com.agentbench.backend;

/**
 * Normalized execution status reported by a backend.
 */
public enum BackendStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
