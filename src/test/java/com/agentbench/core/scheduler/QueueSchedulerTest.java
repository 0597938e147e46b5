package com.agentbench.core.scheduler;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.PollResult;
import com.agentbench.core.error.BackendNotFoundException;
import com.agentbench.core.error.ErrorStages;
import com.agentbench.core.error.InfraException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.events.JobEvent;
import com.agentbench.core.model.InfraHandles;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;
import com.agentbench.core.model.Tier;
import com.agentbench.core.service.SubmissionResult;
import com.agentbench.testing.SchedulerHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class QueueSchedulerTest {

    private SchedulerHarness h;

    @BeforeEach
    void setUp() {
        h = new SchedulerHarness();
    }

    /** Queues a job straight into the store, bypassing submission checks. */
    private Job enqueue(String jobId, ProviderKind provider, int priority, long timeoutMs) {
        Job job = Job.builder()
                .id(jobId)
                .userId("u-" + jobId)
                .agentId("agent-1")
                .query("ping")
                .provider(provider)
                .timeoutMs(timeoutMs)
                .status(JobStatus.QUEUED)
                .submittedAt(h.clock.instant())
                .build();
        return h.jobs.submit(job, QueueEntry.pending("entry-" + jobId, jobId, priority, h.clock.instant()), null);
    }

    private QueueEntry entryOf(String jobId) {
        return h.queue.findByJobId(jobId).orElseThrow();
    }

    // ── Full lifecycle ──────────────────────────────────────────────────

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Freemium foundation-model test runs on the managed runtime and completes")
        void freemiumManagedRuntimeCompletes() {
            h.user("u1", Tier.FREEMIUM, 0);
            h.foundationAgent("a1", "u1");
            h.runtime.emitLogs("Invoking runtime", "Answer ready")
                    .pollsReturn(PollResult.running(List.of()), PollResult.succeeded("2 + 2 = 4"));

            SubmissionResult submitted = h.tests.submitTest("u1", "a1", "What is 2+2?", null, null);
            assertEquals(1, h.scheduler.processQueue());

            Job job = h.job(submitted.jobId());
            assertEquals(JobStatus.COMPLETED, job.status());
            assertEquals(ProviderKind.MANAGED_RUNTIME, job.provider());
            assertEquals(Boolean.TRUE, job.result().success());
            assertTrue(job.result().response().contains("4"));
            assertNotNull(job.completedAt());
            assertNotNull(job.metrics().executionTimeMs());
            assertTrue(job.logs().contains("Answer ready"));
            assertEquals(1, h.userStore.findById("u1").orElseThrow().testsThisMonth());

            QueueEntry entry = entryOf(submitted.jobId());
            assertEquals(QueueEntryStatus.CLAIMED, entry.status());
            assertEquals("worker-test", entry.claimedBy());
            assertEquals("runtime-a1", h.runtime.submitted().get(0).runtimeId());
        }

        @Test
        @DisplayName("Container test builds, records the image and completes")
        void containerBuildsAndCompletes() {
            List<String> statuses = new CopyOnWriteArrayList<>();
            h.eventBus.subscribeAll(e -> {
                if (JobEvent.STATUS.equals(e.eventType())) {
                    statuses.add((String) e.payload().get("status"));
                }
            });
            h.user("u1", Tier.FREEMIUM, 0);
            h.openAgent("a1", "u1");
            h.container.onSubmit(d -> new BackendHandle(ProviderKind.CONTAINER, "task-1", "arn:task-1",
                            "/ecs/agent-tests", "test-1", "registry/agent-test:" + d.jobId(), 1200L))
                    .pollsReturn(PollResult.succeeded("hello"));

            SubmissionResult submitted = h.tests.submitTest("u1", "a1", "Say hello", null, 1);
            h.scheduler.processQueue();

            Job job = h.job(submitted.jobId());
            assertEquals(JobStatus.COMPLETED, job.status());
            assertEquals(List.of("BUILDING", "RUNNING", "COMPLETED"), statuses);
            assertEquals("registry/agent-test:" + job.id(), job.deploymentPackageRef());
            assertEquals(1200L, job.metrics().buildTimeMs());
            assertEquals("task-1", job.infra().taskId());
            assertEquals(0, h.userStore.findById("u1").orElseThrow().testsThisMonth(),
                    "open models on platform containers are free");
        }

        @Test
        @DisplayName("Backend failure after RUNNING fails the job at the runtime stage without retry")
        void runtimeFailureIsFinal() {
            enqueue("j1", ProviderKind.CONTAINER, 2, 60_000);
            h.container.pollsReturn(PollResult.failed("Agent crashed"));

            h.scheduler.processQueue();

            Job job = h.job("j1");
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals("Agent crashed", job.result().error());
            assertEquals(ErrorStages.RUNTIME, job.result().errorStage());
            assertEquals(1, h.container.submitCount());
            assertEquals(0, h.scheduler.processQueue());
        }

        @Test
        @DisplayName("Unknown backend handle fails the job at the runtime stage")
        void backendNotFound() {
            enqueue("j1", ProviderKind.MANAGED_RUNTIME, 2, 60_000);
            h.runtime.onPoll(() -> {
                throw new BackendNotFoundException("Invocation not tracked by this process");
            });

            h.scheduler.processQueue();

            Job job = h.job("j1");
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(ErrorStages.RUNTIME, job.result().errorStage());
        }

        @Test
        @DisplayName("Transient poll errors are retried in place")
        void transientPollErrors() {
            enqueue("j1", ProviderKind.MANAGED_RUNTIME, 2, 60_000);
            AtomicInteger polls = new AtomicInteger();
            h.runtime.onPoll(() -> {
                if (polls.incrementAndGet() <= 2) {
                    throw new InfraException("connection reset");
                }
            }).pollsReturn(PollResult.succeeded("ok"));

            h.scheduler.processQueue();

            assertEquals(JobStatus.COMPLETED, h.job("j1").status());
            assertEquals(1, h.runtime.submitCount());
        }
    }

    // ── Watchdog ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Watchdog")
    class Watchdog {

        @Test
        @DisplayName("A job that outlives its timeout plus grace is cancelled and failed with stage timeout")
        void timeoutFailsAndCancels() {
            h.user("u1", Tier.FREEMIUM, 0);
            h.foundationAgent("a1", "u1");
            h.runtime.onPoll(() -> h.advance(Duration.ofSeconds(10)));

            SubmissionResult submitted = h.tests.submitTest("u1", "a1", "Think forever", 5000L, null);
            h.scheduler.processQueue();

            Job job = h.job(submitted.jobId());
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(ErrorStages.TIMEOUT, job.result().errorStage());
            assertTrue(job.result().error().contains("5000ms"));
            assertEquals(1, h.runtime.cancelled().size());
            assertEquals(1.0, h.meterRegistry.get("agentbench.watchdog.expired").counter().count());
        }

        @Test
        @DisplayName("Sweep fails RUNNING jobs no local worker tracks once past the deadline")
        void sweepUntrackedRunning() {
            enqueue("j1", ProviderKind.CONTAINER, 2, 60_000);
            assertTrue(h.queue.tryClaim("entry-j1", QueueEntryStatus.PENDING, 0, "dead-worker", h.clock.instant()));
            h.stateMachine.transition("j1", JobStatus.RUNNING, j -> j.toBuilder()
                    .infra(new InfraHandles("task-9", "arn:task-9", "/ecs/agent-tests", "s9")).build());

            h.advance(Duration.ofSeconds(60 + 29));
            assertEquals(0, h.scheduler.sweepWatchdog());

            h.advance(Duration.ofSeconds(2));
            assertEquals(1, h.scheduler.sweepWatchdog());

            Job job = h.job("j1");
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(ErrorStages.TIMEOUT, job.result().errorStage());
            assertEquals("task-9", h.container.cancelled().get(0).taskId());
        }
    }

    // ── Retries ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("Retryable dispatch failure is attempted exactly three times, then abandoned")
        void retryCeiling() {
            enqueue("j1", ProviderKind.CONTAINER, 2, 60_000);
            h.container.failSubmitsWith(new InfraException("No capacity in cluster"));

            assertEquals(1, h.scheduler.processQueue());
            QueueEntry afterFirst = entryOf("j1");
            assertEquals(QueueEntryStatus.PENDING, afterFirst.status());
            assertEquals(1, afterFirst.attempts());
            assertEquals(JobStatus.QUEUED, h.job("j1").status());

            h.scheduler.processQueue();
            h.scheduler.processQueue();
            assertEquals(0, h.scheduler.processQueue());

            assertEquals(3, h.container.submitCount());
            Job job = h.job("j1");
            assertEquals(JobStatus.ABANDONED, job.status());
            assertEquals("Test abandoned after 3 retry attempts: No capacity in cluster", job.result().error());
            QueueEntry entry = entryOf("j1");
            assertEquals(QueueEntryStatus.ABANDONED, entry.status());
            assertEquals(3, entry.attempts());
        }

        @Test
        @DisplayName("Non-retryable dispatch failure fails at once without consuming an attempt")
        void nonRetryableFailsImmediately() {
            enqueue("j1", ProviderKind.MANAGED_RUNTIME, 2, 60_000);
            h.runtime.failSubmitsWith(new ValidationException("Agent has no managed runtime id"));

            h.scheduler.processQueue();

            assertEquals(JobStatus.FAILED, h.job("j1").status());
            assertEquals(1, h.runtime.submitCount());
            assertEquals(0, entryOf("j1").attempts());
            assertEquals(QueueEntryStatus.ABANDONED, entryOf("j1").status());
        }

        @Test
        @DisplayName("Submit that never returns is cut off at the deadline and retried")
        void submitTimeout() throws Exception {
            ExecutorService dispatch = Executors.newCachedThreadPool();
            CountDownLatch release = new CountDownLatch(1);
            try {
                h = new SchedulerHarness(Runnable::run, dispatch);
                h.schedulerProperties.setWatchdogGraceMs(0);
                enqueue("j1", ProviderKind.MANAGED_RUNTIME, 2, 1000);
                h.runtime.onSubmit(d -> {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    throw new InfraException("released");
                });

                h.scheduler.processQueue();

                QueueEntry entry = entryOf("j1");
                assertEquals(QueueEntryStatus.PENDING, entry.status());
                assertEquals(1, entry.attempts());
                assertTrue(entry.lastError().contains("did not return"));
                assertEquals(JobStatus.QUEUED, h.job("j1").status());
            } finally {
                release.countDown();
                dispatch.shutdownNow();
            }
        }

        @Test
        @DisplayName("Stale claim counts as a failed attempt, and the third one abandons")
        void staleClaims() {
            enqueue("j1", ProviderKind.CONTAINER, 2, 60_000);

            for (int attempt = 0; attempt < 3; attempt++) {
                assertTrue(h.queue.tryClaim("entry-j1", QueueEntryStatus.PENDING, attempt, "dead-worker",
                        h.clock.instant()));
                h.advance(Duration.ofMinutes(10));
                assertEquals(0, h.scheduler.cleanupStaleClaims(), "not stale yet");
                h.advance(Duration.ofMinutes(6));
                assertEquals(1, h.scheduler.cleanupStaleClaims());
            }

            Job job = h.job("j1");
            assertEquals(JobStatus.ABANDONED, job.status());
            assertEquals("Test abandoned after 3 retry attempts: Test abandoned - claimed but never started",
                    job.result().error());
            assertEquals(ErrorStages.SERVICE, job.result().errorStage());
            assertEquals(0, h.container.submitCount());
        }
    }

    // ── Claiming ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Claiming")
    class Claiming {

        private final List<String> dispatched = new CopyOnWriteArrayList<>();
        private JobRunner runner;

        @BeforeEach
        void setUpRunner() {
            runner = mock(JobRunner.class);
            doAnswer(inv -> {
                dispatched.add(inv.<QueueEntry>getArgument(0).jobId());
                return null;
            }).when(runner).run(any());
        }

        private QueueScheduler scheduler(String workerId, int batchSize, int maxConcurrent) {
            SchedulerProperties props = new SchedulerProperties();
            props.setWorkerId(workerId);
            props.setClaimBatchSize(batchSize);
            props.setMaxConcurrent(maxConcurrent);
            return new QueueScheduler(h.queue, h.jobs, runner, h.backends, props, h.metrics, h.eventBus,
                    Runnable::run, h.clock);
        }

        @Test
        @DisplayName("Entries are claimed by priority, then oldest first")
        void priorityThenFifo() {
            enqueue("low", ProviderKind.CONTAINER, 3, 60_000);
            h.advance(Duration.ofSeconds(1));
            enqueue("normal-old", ProviderKind.CONTAINER, 2, 60_000);
            h.advance(Duration.ofSeconds(1));
            enqueue("high", ProviderKind.CONTAINER, 1, 60_000);
            h.advance(Duration.ofSeconds(1));
            enqueue("normal-new", ProviderKind.CONTAINER, 2, 60_000);

            QueueScheduler scheduler = scheduler("w1", 1, 10);
            for (int i = 0; i < 4; i++) {
                scheduler.processQueue();
            }

            assertEquals(List.of("high", "normal-old", "normal-new", "low"), dispatched);
        }

        @Test
        @DisplayName("No claims while at the in-flight ceiling")
        void respectsCapacity() {
            enqueue("r1", ProviderKind.CONTAINER, 2, 60_000);
            enqueue("r2", ProviderKind.CONTAINER, 2, 60_000);
            h.stateMachine.transition("r1", JobStatus.RUNNING);
            h.stateMachine.transition("r2", JobStatus.BUILDING);
            enqueue("waiting", ProviderKind.CONTAINER, 2, 60_000);

            assertEquals(0, scheduler("w1", 3, 2).processQueue());
            verify(runner, never()).run(any());
        }

        @Test
        @DisplayName("Two workers racing for one entry: exactly one claims it")
        void twoWorkersOneEntry() throws Exception {
            enqueue("j1", ProviderKind.CONTAINER, 2, 60_000);
            QueueScheduler a = scheduler("worker-a", 3, 10);
            QueueScheduler b = scheduler("worker-b", 3, 10);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<Integer> fa = pool.submit(() -> {
                    start.await();
                    return a.processQueue();
                });
                Future<Integer> fb = pool.submit(() -> {
                    start.await();
                    return b.processQueue();
                });
                start.countDown();
                assertEquals(1, fa.get(5, TimeUnit.SECONDS) + fb.get(5, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }

            verify(runner, times(1)).run(any());
            QueueEntry entry = entryOf("j1");
            assertEquals(QueueEntryStatus.CLAIMED, entry.status());
            assertTrue(List.of("worker-a", "worker-b").contains(entry.claimedBy()));
        }

        @Test
        @DisplayName("Many workers over many entries never dispatch an entry twice")
        void manyWorkersNoDoubleDispatch() throws Exception {
            for (int i = 0; i < 30; i++) {
                enqueue("j" + i, ProviderKind.CONTAINER, 1 + i % 3, 60_000);
            }
            List<QueueScheduler> workers = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                workers.add(scheduler("worker-" + w, 30, 100));
            }

            ExecutorService pool = Executors.newFixedThreadPool(workers.size());
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            try {
                for (QueueScheduler worker : workers) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return worker.processQueue();
                    }));
                }
                start.countDown();
                int total = 0;
                for (Future<Integer> f : results) {
                    total += f.get(10, TimeUnit.SECONDS);
                }
                assertEquals(30, total);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(30, dispatched.size());
            assertEquals(30, new HashSet<>(dispatched).size());
            assertEquals(0, h.queue.countPending());
        }

        @Test
        @DisplayName("A cancelled (abandoned) entry is never claimed")
        void abandonedNotClaimed() {
            enqueue("j1", ProviderKind.CONTAINER, 2, 60_000);
            QueueEntry entry = entryOf("j1");
            assertTrue(h.queue.compareAndSet(entry, entry.abandoned("Cancelled by user", false)));

            assertEquals(0, scheduler("w1", 3, 10).processQueue());
        }
    }
}
