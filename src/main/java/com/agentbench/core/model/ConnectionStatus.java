package com.agentbench.core.model;

/**
 * Status of a user's cross-account trust record.
 */
public enum ConnectionStatus {
    PENDING,
    CONNECTED,
    DISCONNECTED;

    public String value() {
        return name().toLowerCase();
    }
}
