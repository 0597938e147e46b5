package com.agentbench.core.model;

/**
 * Which execution backend a job is dispatched to.
 */
public enum ProviderKind {
    /** Build an image and run it as a task on an elastic container executor. */
    CONTAINER("container"),
    /** Invoke a hosted agent runtime sandbox by reference id. */
    MANAGED_RUNTIME("managed-runtime");

    private final String tag;

    ProviderKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** Image build is only needed for the container path. */
    public boolean requiresBuild() {
        return this == CONTAINER;
    }

    public static ProviderKind fromTag(String tag) {
        for (ProviderKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(tag) || kind.name().equalsIgnoreCase(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown provider tag: " + tag);
    }
}
