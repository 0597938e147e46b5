package com.agentbench.core.collector;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.LogPage;
import com.agentbench.core.events.JobEvent;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.testing.SchedulerHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogCollectorTest {

    private SchedulerHarness h;
    private BackendHandle handle;

    @BeforeEach
    void setUp() {
        h = new SchedulerHarness();
        Job job = Job.builder().id("j1").userId("u1").agentId("a1").query("q")
                .provider(ProviderKind.CONTAINER).timeoutMs(60_000).status(JobStatus.RUNNING)
                .submittedAt(h.clock.instant()).build();
        h.jobs.submit(job, QueueEntry.pending("e1", "j1", 2, h.clock.instant()), null);
        handle = new BackendHandle(ProviderKind.CONTAINER, "task-j1", "arn", "/g", "s", null, 0L);
    }

    @Test
    @DisplayName("Draining twice with nothing new appends each line once")
    void drainIsIdempotent() {
        h.container.emitLogs("starting", "thinking");

        assertEquals(2, h.collector.drain("j1", h.container, handle));
        assertEquals(0, h.collector.drain("j1", h.container, handle));

        h.container.emitLogs("done");
        assertEquals(1, h.collector.drain("j1", h.container, handle));

        Job job = h.job("j1");
        assertEquals(List.of("starting", "thinking", "done"), job.logs());
        assertEquals("3", job.logCursor());
        assertEquals(h.clock.instant(), job.lastLogFetchedAt());
    }

    @Test
    @DisplayName("A page fetched from an outdated cursor is discarded")
    void staleCursorLoses() {
        h.container.emitLogs("a", "b");
        LogPage page = h.container.fetchLogs(handle, null);

        assertEquals(2, h.collector.appendPage("j1", null, page));
        assertEquals(0, h.collector.appendPage("j1", null, page));
        assertEquals(List.of("a", "b"), h.job("j1").logs());
    }

    @Test
    @DisplayName("Scheduler lines keep the backend cursor")
    void appendLogsKeepsCursor() {
        h.container.emitLogs("a");
        h.collector.drain("j1", h.container, handle);

        h.collector.appendLog("j1", "[agentbench] retrying");

        Job job = h.job("j1");
        assertEquals(List.of("a", "[agentbench] retrying"), job.logs());
        assertEquals("1", job.logCursor());
    }

    @Test
    @DisplayName("New lines are published as a progress event")
    void publishesProgress() {
        List<JobEvent> events = new ArrayList<>();
        h.eventBus.subscribe("j1", events::add);
        h.container.emitLogs("hello");

        h.collector.drain("j1", h.container, handle);
        h.collector.drain("j1", h.container, handle);

        assertEquals(1, events.size());
        assertEquals(JobEvent.PROGRESS, events.get(0).eventType());
        assertEquals(List.of("hello"), events.get(0).payload().get("lines"));
    }
}
