package com.agentbench.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of probing one part of the scheduler (store, database, backends, worker).
 * The service is reported DOWN only when some component is DOWN; DEGRADED parts are listed but
 * keep it in rotation.
 */
public record HealthStatus(String component, Status status, String detail, Map<String, String> metadata) {

    /** Ordered from best to worst. */
    public enum Status {
        UP, DEGRADED, DOWN;

        Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /** Worst status among the checks, UP for none. */
    public static Status overall(List<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            worst = worst.worse(check.status());
        }
        return worst;
    }
}
