package com.agentbench.core.health;

import com.agentbench.backend.BackendRegistry;
import com.agentbench.core.model.Tier;
import com.agentbench.testing.SchedulerHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckServiceTest {

    private SchedulerHarness h;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        h = new SchedulerHarness();
        service = new HealthCheckService(h.queue, h.backends, h.scheduler, h.schedulerProperties, null, h.clock);
    }

    private static HealthStatus component(List<HealthStatus> checks, String name) {
        return checks.stream().filter(c -> c.component().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("An idle worker with both backends is UP")
    void allUp() {
        List<HealthStatus> checks = service.checkAll();

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(checks));
        assertEquals("0", component(checks, "queue").metadata().get("pending"));
        assertTrue(checks.stream().noneMatch(c -> c.component().equals("database")));
    }

    @Test
    @DisplayName("A pending test older than the claim timeout degrades the queue")
    void staleQueueDegrades() {
        h.user("u1", Tier.FREEMIUM, 0);
        h.openAgent("a1", "u1");
        h.tests.submitTest("u1", "a1", "hi", null, null);

        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "queue").status());

        h.advance(Duration.ofMinutes(16));
        HealthStatus queue = component(service.checkAll(), "queue");

        assertEquals(HealthStatus.Status.DEGRADED, queue.status());
        assertEquals(String.valueOf(Duration.ofMinutes(16).toMillis()), queue.metadata().get("oldest_pending_age_ms"));
    }

    @Test
    @DisplayName("A missing backend degrades; none at all is DOWN")
    void backends() {
        service = new HealthCheckService(h.queue, new BackendRegistry(List.of(h.container)), h.scheduler,
                h.schedulerProperties, null, h.clock);
        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "backends").status());

        service = new HealthCheckService(h.queue, new BackendRegistry(List.of()), h.scheduler,
                h.schedulerProperties, null, h.clock);
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(service.checkAll()));
    }

    @Test
    @DisplayName("Overall status is the worst component")
    void overall() {
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(
                HealthStatus.up("queue", "ok", Map.of()),
                HealthStatus.degraded("scheduler", "disabled", null))));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(
                HealthStatus.down("database", "refused"),
                HealthStatus.degraded("scheduler", "disabled", Map.of()))));
    }
}
