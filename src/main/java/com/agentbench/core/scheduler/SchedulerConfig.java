package com.agentbench.core.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs claimed job lifecycles; sized to the concurrency cap. */
    @Bean
    public ExecutorService schedulerWorkers(SchedulerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrent()), named("job-worker"));
    }

    /** Runs backend submit calls so the worker can bound them by the job deadline. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService dispatchExecutor() {
        return Executors.newCachedThreadPool(named("job-dispatch"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "agentbench.scheduler.enabled", havingValue = "true", matchIfMissing = true)
    static class PeriodicTicks {
    }
}
