package com.agentbench.core.store;

import com.agentbench.core.error.UsageLimitExceededException;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.InfraHandles;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobMetrics;
import com.agentbench.core.model.JobResult;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;
import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JDBC stores against H2 in PostgreSQL mode.
 */
class JdbcStoresTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private JdbcJobStore jobs;
    private JdbcQueueStore queue;
    private JdbcUserStore users;
    private JdbcAgentStore agents;

    @BeforeEach
    void setUp() throws Exception {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        JdbcSchema.createTables(dataSource);
        jobs = new JdbcJobStore(dataSource);
        queue = new JdbcQueueStore(dataSource);
        users = new JdbcUserStore(dataSource);
        agents = new JdbcAgentStore(dataSource);
        users.save(new UserAccount("u1", Tier.FREEMIUM, 0, T0));
    }

    private static Job job(String id, Instant submittedAt) {
        return Job.builder()
                .id(id)
                .userId("u1")
                .agentId("a1")
                .query("What is 2+2?")
                .artifact(new ExecutionArtifact("print(4)", "", null))
                .provider(ProviderKind.MANAGED_RUNTIME)
                .providerConfig(new ProviderConfig(null, "anthropic.claude-3-haiku", "us-east-1"))
                .timeoutMs(60_000)
                .status(JobStatus.QUEUED)
                .submittedAt(submittedAt)
                .metrics(JobMetrics.empty())
                .build();
    }

    @Nested
    @DisplayName("JdbcJobStore")
    class Jobs {

        @Test
        @DisplayName("Job document round-trips with nested records")
        void documentRoundTrip() {
            jobs.submit(job("j1", T0), QueueEntry.pending("e1", "j1", 2, T0), null);
            jobs.update("j1", j -> j.toBuilder()
                    .status(JobStatus.RUNNING)
                    .infra(new InfraHandles("task-1", "arn:task-1", "/g", "s"))
                    .logs(List.of("line 1", "line 2"))
                    .logCursor("2")
                    .startedAt(T0.plusSeconds(3))
                    .build());

            Job loaded = jobs.findById("j1").orElseThrow();
            assertEquals(JobStatus.RUNNING, loaded.status());
            assertEquals("task-1", loaded.infra().taskId());
            assertEquals(List.of("line 1", "line 2"), loaded.logs());
            assertEquals("2", loaded.logCursor());
            assertEquals(T0.plusSeconds(3), loaded.startedAt());
            assertEquals("anthropic.claude-3-haiku", loaded.providerConfig().modelId());
        }

        @Test
        @DisplayName("Rejected usage charge rolls back job and entry")
        void chargeRollsBack() {
            users.save(new UserAccount("u1", Tier.FREEMIUM, 10, T0));

            assertThrows(UsageLimitExceededException.class,
                    () -> jobs.submit(job("j1", T0), QueueEntry.pending("e1", "j1", 2, T0),
                            new UsageCharge("u1", 10)));

            assertTrue(jobs.findById("j1").isEmpty());
            assertTrue(queue.findByJobId("j1").isEmpty());
        }

        @Test
        @DisplayName("Accepted usage charge increments the counter")
        void chargeApplied() {
            jobs.submit(job("j1", T0), QueueEntry.pending("e1", "j1", 2, T0), new UsageCharge("u1", 10));
            assertEquals(1, users.findById("u1").orElseThrow().testsThisMonth());
        }

        @Test
        @DisplayName("Concurrency limit counts only unfinished jobs")
        void concurrencyLimitSequential() {
            jobs.submit(job("j1", T0), QueueEntry.pending("e1", "j1", 2, T0), null, 1);
            assertThrows(UsageLimitExceededException.class,
                    () -> jobs.submit(job("j2", T0), QueueEntry.pending("e2", "j2", 2, T0), null, 1));
            assertTrue(queue.findByJobId("j2").isEmpty());

            jobs.update("j1", j -> j.toBuilder().status(JobStatus.FAILED).completedAt(T0.plusSeconds(1)).build());
            jobs.submit(job("j3", T0), QueueEntry.pending("e3", "j3", 2, T0), null, 1);

            assertTrue(jobs.findById("j3").isPresent());
        }

        @Test
        @DisplayName("Racing submissions of one user respect the concurrency limit")
        void concurrencyLimitUnderRace() throws Exception {
            int threads = 6;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    String id = "j" + i;
                    results.add(pool.submit(() -> {
                        start.await();
                        try {
                            jobs.submit(job(id, T0), QueueEntry.pending("e-" + id, id, 2, T0), null, 1);
                            return true;
                        } catch (UsageLimitExceededException e) {
                            return false;
                        }
                    }));
                }
                start.countDown();
                int accepted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(20, TimeUnit.SECONDS)) {
                        accepted++;
                    }
                }
                assertEquals(1, accepted);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, jobs.countUnfinishedByUser("u1"));
            assertEquals(1, queue.countPending());
        }

        @Test
        @DisplayName("Queries by agent, user, status and recency")
        void queries() {
            jobs.submit(job("old", T0), QueueEntry.pending("e1", "old", 2, T0), null);
            jobs.submit(job("new", T0.plusSeconds(5)), QueueEntry.pending("e2", "new", 2, T0.plusSeconds(5)), null);
            jobs.update("old", j -> j.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .result(JobResult.succeeded("4"))
                    .completedAt(T0.plusSeconds(9))
                    .build());

            assertEquals(List.of("new", "old"), jobs.findByAgent("a1", 10).stream().map(Job::id).toList());
            assertEquals(List.of("new"), jobs.findByUser("u1", JobStatus.QUEUED, 10).stream().map(Job::id).toList());
            assertEquals(2, jobs.findByUser("u1", null, 10).size());
            assertEquals(List.of("old"), jobs.findRecentlyCompleted(5).stream().map(Job::id).toList());
            assertEquals(1, jobs.countUnfinishedByUser("u1"));
            assertEquals(1, jobs.countByStatus(EnumSet.of(JobStatus.QUEUED)));
        }
    }

    @Nested
    @DisplayName("JdbcQueueStore")
    class Queue {

        @BeforeEach
        void seed() {
            jobs.submit(job("j1", T0), QueueEntry.pending("e1", "j1", 3, T0), null);
            jobs.submit(job("j2", T0), QueueEntry.pending("e2", "j2", 1, T0.plusSeconds(2)), null);
            jobs.submit(job("j3", T0), QueueEntry.pending("e3", "j3", 1, T0.plusSeconds(1)), null);
        }

        @Test
        @DisplayName("Selection order and queue position")
        void selection() {
            assertEquals(List.of("e3", "e2", "e1"), queue.findPending(10).stream().map(QueueEntry::id).toList());
            assertEquals(2, queue.countPendingAhead(queue.findById("e1").orElseThrow()));
            assertEquals(0, queue.countPendingAhead(queue.findById("e3").orElseThrow()));
            assertEquals(T0, queue.oldestPendingCreatedAt().orElseThrow());
        }

        @Test
        @DisplayName("Claim, requeue and abandon through compare-and-set")
        void claimLifecycle() {
            assertTrue(queue.tryClaim("e1", QueueEntryStatus.PENDING, 0, "w1", T0.plusSeconds(5)));
            assertFalse(queue.tryClaim("e1", QueueEntryStatus.PENDING, 0, "w2", T0.plusSeconds(5)));

            QueueEntry claimed = queue.findById("e1").orElseThrow();
            assertEquals("w1", claimed.claimedBy());
            assertEquals(1, queue.findClaimedBefore(T0.plusSeconds(6)).size());

            assertTrue(queue.compareAndSet(claimed, claimed.requeued("boom")));
            assertFalse(queue.compareAndSet(claimed, claimed.abandoned("late", true)), "stale snapshot loses");

            QueueEntry requeued = queue.findById("e1").orElseThrow();
            assertEquals(QueueEntryStatus.PENDING, requeued.status());
            assertEquals(1, requeued.attempts());
            assertEquals("boom", requeued.lastError());
            assertNull(requeued.claimedBy());
        }

        @Test
        @DisplayName("Concurrent claims through separate connections: one winner")
        void concurrentClaims() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(6);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < 6; i++) {
                    String worker = "w" + i;
                    results.add(pool.submit(() -> {
                        start.await();
                        return queue.tryClaim("e2", QueueEntryStatus.PENDING, 0, worker, T0);
                    }));
                }
                start.countDown();
                long wins = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        wins++;
                    }
                }
                assertEquals(1, wins);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("JdbcUserStore and documents")
    class Users {

        @Test
        @DisplayName("tryIncrementUsage stops at the cap; reset clears one tier")
        void usage() {
            assertTrue(users.tryIncrementUsage("u1", 2));
            assertTrue(users.tryIncrementUsage("u1", 2));
            assertFalse(users.tryIncrementUsage("u1", 2));
            assertTrue(users.tryIncrementUsage("u1", -1));
            assertEquals(3, users.findById("u1").orElseThrow().testsThisMonth());

            users.save(new UserAccount("p1", Tier.PERSONAL, 7, T0));
            assertEquals(1, users.resetUsage(Tier.FREEMIUM, T0.plusSeconds(60)));
            assertEquals(0, users.findById("u1").orElseThrow().testsThisMonth());
            assertEquals(7, users.findById("p1").orElseThrow().testsThisMonth());
        }

        @Test
        @DisplayName("refundUsage gives one charge back and stops at zero")
        void refund() {
            users.tryIncrementUsage("u1", 10);
            users.refundUsage("u1");
            users.refundUsage("u1");

            assertEquals(0, users.findById("u1").orElseThrow().testsThisMonth());
        }

        @Test
        @DisplayName("Agents are stored as documents")
        void agents() {
            agents.save(new Agent("a1", "u1", "Helper", new ExecutionArtifact("code", "req", "FROM x"),
                    new ProviderConfig("http://ollama:11434", "llama3", null), null, true));

            Agent loaded = agents.findById("a1").orElseThrow();
            assertEquals("Helper", loaded.name());
            assertTrue(loaded.isPublic());
            assertEquals("FROM x", loaded.artifact().dockerfile());
            assertTrue(agents.findById("missing").isEmpty());
        }
    }
}
