package com.agentbench.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SchedulerMetrics metrics = new SchedulerMetrics(registry);

    @Test
    @DisplayName("Counters are tagged and accumulate")
    void counters() {
        metrics.recordSubmission("CONTAINER");
        metrics.recordSubmission("CONTAINER");
        metrics.recordUsageRejection("FREEMIUM");
        metrics.recordJobResult("FAILED", "MANAGED_RUNTIME");

        assertEquals(2.0, registry.get("agentbench.jobs.submitted").tag("provider", "CONTAINER").counter().count());
        assertEquals(1.0, registry.get("agentbench.jobs.rejected")
                .tag("reason", "usage_limit").tag("tier", "FREEMIUM").counter().count());
        assertEquals(1.0, registry.get("agentbench.jobs.finished")
                .tag("status", "FAILED").tag("provider", "MANAGED_RUNTIME").counter().count());
    }

    @Test
    @DisplayName("Timers record durations in milliseconds")
    void timers() {
        metrics.recordQueueWait(1500);
        metrics.recordExecution("CONTAINER", 250);

        assertEquals(1500.0, registry.get("agentbench.queue.wait").timer().totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1, registry.get("agentbench.execution.duration").tag("provider", "CONTAINER").timer().count());
    }
}
