package com.agentbench.core.model;

/**
 * Status of a queue entry. Persisted in lower case.
 */
public enum QueueEntryStatus {
    PENDING,
    CLAIMED,
    ABANDONED;

    public String value() {
        return name().toLowerCase();
    }

    public static QueueEntryStatus fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
