package com.agentbench.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for queueing and execution.
 */
@Service
public class SchedulerMetrics {

    private final MeterRegistry registry;

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSubmission(String provider) {
        Counter.builder("agentbench.jobs.submitted")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void recordUsageRejection(String tier) {
        Counter.builder("agentbench.jobs.rejected")
                .tag("reason", "usage_limit")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordClaim() {
        Counter.builder("agentbench.queue.claims")
                .register(registry)
                .increment();
    }

    /**
     * Records a lost compare-and-set on a queue entry. A steady non-zero rate is expected with
     * several workers; a spike means workers are fighting over a short queue.
     */
    public void recordClaimConflict() {
        Counter.builder("agentbench.queue.claim_conflicts")
                .description("Claims lost to another worker")
                .register(registry)
                .increment();
    }

    public void recordRetry(String errorKind) {
        Counter.builder("agentbench.jobs.retries")
                .tag("kind", errorKind)
                .register(registry)
                .increment();
    }

    public void recordJobResult(String status, String provider) {
        Counter.builder("agentbench.jobs.finished")
                .tag("status", status)
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void recordQueueWait(long ms) {
        Timer.builder("agentbench.queue.wait")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBuildDuration(long ms) {
        Timer.builder("agentbench.build.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordExecution(String provider, long ms) {
        Timer.builder("agentbench.execution.duration")
                .tag("provider", provider)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWatchdogExpiry() {
        Counter.builder("agentbench.watchdog.expired")
                .register(registry)
                .increment();
    }
}
