package com.agentbench.core.collector;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.ExecutionBackend;
import com.agentbench.backend.LogPage;
import com.agentbench.core.error.AgentBenchException;
import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.events.JobEvent;
import com.agentbench.core.events.JobEventBus;
import com.agentbench.core.model.Job;
import com.agentbench.core.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drains backend logs into job records.
 * <p>
 * A page is only appended if the job's stored cursor still equals the cursor the page was
 * fetched from. Two drains racing on the same cursor therefore append the page once, and a
 * repeated fetch with an unchanged cursor never duplicates lines.
 */
@Component
public class LogCollector {

    private static final Logger log = LoggerFactory.getLogger(LogCollector.class);

    private final JobStore jobs;
    private final JobEventBus eventBus;
    private final Clock clock;

    public LogCollector(JobStore jobs, JobEventBus eventBus, Clock clock) {
        this.jobs = jobs;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Fetches everything after the job's cursor and appends it.
     *
     * @return number of lines appended
     */
    public int drain(String jobId, ExecutionBackend backend, BackendHandle handle) {
        Job current = jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException("Job", jobId));
        String cursor = current.logCursor();
        LogPage page = backend.fetchLogs(handle, cursor);
        int appended = appendPage(jobId, cursor, page);
        if (appended > 0) {
            eventBus.publish(new JobEvent(JobEvent.PROGRESS, jobId,
                    Map.of("lines", page.lines()), Instant.now(clock)));
        }
        return appended;
    }

    /**
     * Last drain on a terminal transition, capturing output written between the last poll and
     * the end of the job. Failures are logged; the job outcome does not depend on them.
     */
    public void finalDrain(String jobId, ExecutionBackend backend, BackendHandle handle) {
        try {
            int lines = drain(jobId, backend, handle);
            log.debug("Final drain of job {} appended {} line(s)", jobId, lines);
        } catch (AgentBenchException e) {
            log.warn("Final log drain failed for job {}: {}", jobId, e.getMessage());
        }
    }

    /**
     * Appends lines produced by the scheduler itself, leaving the backend cursor untouched.
     */
    public Job appendLogs(String jobId, List<String> lines) {
        Instant now = now();
        return jobs.update(jobId, job -> {
            List<String> merged = new ArrayList<>(job.logs());
            merged.addAll(lines);
            return job.toBuilder().logs(merged).lastLogFetchedAt(now).build();
        });
    }

    public Job appendLog(String jobId, String line) {
        return appendLogs(jobId, List.of(line));
    }

    int appendPage(String jobId, String fetchedFrom, LogPage page) {
        Instant now = now();
        int[] appended = {0};
        jobs.update(jobId, job -> {
            if (!Objects.equals(job.logCursor(), fetchedFrom)) {
                // another drain already consumed this page
                appended[0] = 0;
                return job;
            }
            List<String> merged = new ArrayList<>(job.logs());
            merged.addAll(page.lines());
            appended[0] = page.lines().size();
            return job.toBuilder()
                    .logs(merged)
                    .logCursor(page.nextCursor())
                    .lastLogFetchedAt(now)
                    .build();
        });
        return appended[0];
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
