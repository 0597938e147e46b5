package com.agentbench.core.store;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.UsageLimitExceededException;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private InMemoryQueueStore queue;
    private InMemoryUserStore users;
    private InMemoryJobStore jobs;

    @BeforeEach
    void setUp() {
        queue = new InMemoryQueueStore();
        users = new InMemoryUserStore();
        jobs = new InMemoryJobStore(queue, users);
        users.save(new UserAccount("u1", Tier.FREEMIUM, 9, T0));
    }

    private static Job job(String id) {
        return Job.builder().id(id).userId("u1").agentId("a1").query("q").provider(ProviderKind.CONTAINER)
                .timeoutMs(1000).status(JobStatus.QUEUED).submittedAt(T0).build();
    }

    @Test
    @DisplayName("submit writes job, entry and usage together")
    void submitIsAtomic() {
        jobs.submit(job("j1"), QueueEntry.pending("e1", "j1", 2, T0), new UsageCharge("u1", 10));

        assertTrue(jobs.findById("j1").isPresent());
        assertTrue(queue.findByJobId("j1").isPresent());
        assertEquals(10, users.findById("u1").orElseThrow().testsThisMonth());
    }

    @Test
    @DisplayName("A rejected charge writes nothing")
    void rejectedChargeWritesNothing() {
        users.save(new UserAccount("u1", Tier.FREEMIUM, 10, T0));

        assertThrows(UsageLimitExceededException.class,
                () -> jobs.submit(job("j1"), QueueEntry.pending("e1", "j1", 2, T0), new UsageCharge("u1", 10)));

        assertTrue(jobs.findById("j1").isEmpty());
        assertTrue(queue.findByJobId("j1").isEmpty());
        assertEquals(10, users.findById("u1").orElseThrow().testsThisMonth());
    }

    @Test
    @DisplayName("Concurrency limit is checked before the charge")
    void concurrencyLimitBeforeCharge() {
        jobs.submit(job("j1"), QueueEntry.pending("e1", "j1", 2, T0), new UsageCharge("u1", 100), 1);

        assertThrows(UsageLimitExceededException.class,
                () -> jobs.submit(job("j2"), QueueEntry.pending("e2", "j2", 2, T0), new UsageCharge("u1", 100), 1));

        assertTrue(jobs.findById("j2").isEmpty());
        assertEquals(1, jobs.countUnfinishedByUser("u1"));
        assertEquals(10, users.findById("u1").orElseThrow().testsThisMonth());
    }

    @Test
    @DisplayName("Negative cap means unlimited")
    void unlimitedCharge() {
        users.save(new UserAccount("u1", Tier.ENTERPRISE, 5000, T0));
        jobs.submit(job("j1"), QueueEntry.pending("e1", "j1", 2, T0), new UsageCharge("u1", -1));
        assertEquals(5001, users.findById("u1").orElseThrow().testsThisMonth());
    }

    @Test
    @DisplayName("update of a missing job throws; counts follow statuses")
    void updateAndCount() {
        assertThrows(JobNotFoundException.class, () -> jobs.update("nope", j -> j));

        jobs.submit(job("j1"), QueueEntry.pending("e1", "j1", 2, T0), null);
        jobs.submit(job("j2"), QueueEntry.pending("e2", "j2", 2, T0), null);
        jobs.update("j1", j -> j.toBuilder().status(JobStatus.RUNNING).build());

        assertEquals(1, jobs.countByStatus(EnumSet.of(JobStatus.BUILDING, JobStatus.RUNNING)));
        assertEquals(2, jobs.countUnfinishedByUser("u1"));
        assertEquals(1, jobs.findByStatus(JobStatus.QUEUED).size());
    }
}
