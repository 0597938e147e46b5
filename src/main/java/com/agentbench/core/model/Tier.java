package com.agentbench.core.model;

/**
 * Service level of a user.
 */
public enum Tier {
    FREEMIUM,
    PERSONAL,
    ENTERPRISE;

    public String value() {
        return name().toLowerCase();
    }

    public static Tier fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }

    /** Whether jobs run in the user's own cloud account through cross-account trust. */
    public boolean usesOwnAccount() {
        return this != FREEMIUM;
    }
}
