package com.agentbench.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of job lifecycle events.
 * <p>
 * Listeners can follow one job, one event type (the scheduler's on-demand tick on
 * {@link JobEvent#QUEUED}) or everything (the CLI's {@code --wait}, which has to listen before the
 * job id exists). Delivery is synchronous on the
 * publishing thread, job listeners first, so a job's events arrive in the order its lifecycle
 * produced them.
 */
@Service
public class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<JobEvent>>> byJob = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<JobEvent>>> byType = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<JobEvent>> everything = new CopyOnWriteArrayList<>();

    public void publish(JobEvent event) {
        log.debug("Job {}: {}", event.jobId(), event.eventType());
        deliver(byJob.get(event.jobId()), event);
        deliver(byType.get(event.eventType()), event);
        deliver(everything, event);
    }

    public Subscription subscribe(String jobId, Consumer<JobEvent> listener) {
        return register(byJob, jobId, listener);
    }

    public Subscription subscribeToType(String eventType, Consumer<JobEvent> listener) {
        return register(byType, eventType, listener);
    }

    public Subscription subscribeAll(Consumer<JobEvent> listener) {
        everything.add(listener);
        return () -> everything.remove(listener);
    }

    int listenerCount(String jobId) {
        List<Consumer<JobEvent>> listeners = byJob.get(jobId);
        return listeners == null ? 0 : listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static Subscription register(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<JobEvent>>> index,
                                         String key, Consumer<JobEvent> listener) {
        index.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> index.computeIfPresent(key, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    private static void deliver(List<Consumer<JobEvent>> listeners, JobEvent event) {
        if (listeners == null) {
            return;
        }
        for (Consumer<JobEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for job {}: {}", event.eventType(), event.jobId(), e.getMessage(), e);
            }
        }
    }
}
