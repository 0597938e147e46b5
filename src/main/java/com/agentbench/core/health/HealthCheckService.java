package com.agentbench.core.health;

import com.agentbench.backend.BackendRegistry;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.scheduler.QueueScheduler;
import com.agentbench.core.scheduler.SchedulerProperties;
import com.agentbench.core.store.QueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Probes the parts a worker needs: the queue store (and how long the oldest entry has waited),
 * the database when one is configured, the execution backends and the local scheduler.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final QueueStore queueStore;
    private final BackendRegistry backends;
    private final QueueScheduler scheduler;
    private final SchedulerProperties schedulerProperties;
    private final DataSource dataSource;
    private final Clock clock;

    public HealthCheckService(QueueStore queueStore, BackendRegistry backends, QueueScheduler scheduler,
                              SchedulerProperties schedulerProperties,
                              @Autowired(required = false) DataSource dataSource, Clock clock) {
        this.queueStore = queueStore;
        this.backends = backends;
        this.scheduler = scheduler;
        this.schedulerProperties = schedulerProperties;
        this.dataSource = dataSource;
        this.clock = clock;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkQueue());
        if (dataSource != null) {
            results.add(checkDatabase());
        }
        results.add(checkBackends());
        results.add(checkScheduler());
        return results;
    }

    /** A pending entry older than the claim timeout means no worker is draining the queue. */
    private HealthStatus checkQueue() {
        long pending;
        Optional<Instant> oldest;
        try {
            pending = queueStore.countPending();
            oldest = queueStore.oldestPendingCreatedAt();
        } catch (RuntimeException e) {
            log.warn("Queue store health check failed: {}", e.getMessage());
            return HealthStatus.down("queue", "Queue store error: " + e.getMessage());
        }
        long ageMs = oldest.map(created -> Duration.between(created, clock.instant()).toMillis()).orElse(0L);
        Map<String, String> metadata = Map.of(
                "pending", String.valueOf(pending),
                "oldest_pending_age_ms", String.valueOf(ageMs));
        if (ageMs > schedulerProperties.getClaimTimeoutMs()) {
            return HealthStatus.degraded("queue",
                    "Oldest pending test has waited " + Duration.ofMillis(ageMs).toSeconds() + "s", metadata);
        }
        return HealthStatus.up("queue", pending + " pending", metadata);
    }

    private HealthStatus checkDatabase() {
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid", Map.of());
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    private HealthStatus checkBackends() {
        boolean container = backends.supports(ProviderKind.CONTAINER);
        boolean runtime = backends.supports(ProviderKind.MANAGED_RUNTIME);
        Map<String, String> metadata = Map.of(
                ProviderKind.CONTAINER.tag(), container ? "available" : "missing",
                ProviderKind.MANAGED_RUNTIME.tag(), runtime ? "available" : "missing");
        if (container && runtime) {
            return HealthStatus.up("backends", "All execution backends available", metadata);
        }
        if (container || runtime) {
            return HealthStatus.degraded("backends", "Some execution backends are not configured", metadata);
        }
        return new HealthStatus("backends", HealthStatus.Status.DOWN, "No execution backend configured", metadata);
    }

    private HealthStatus checkScheduler() {
        if (!schedulerProperties.isEnabled()) {
            return HealthStatus.degraded("scheduler", "Queue processing disabled on this instance", Map.of());
        }
        return HealthStatus.up("scheduler", "Worker " + schedulerProperties.getWorkerId() + " running",
                Map.of("in_flight", String.valueOf(scheduler.trackedCount())));
    }
}
