package com.agentbench.testing;

import com.agentbench.backend.BackendProperties;
import com.agentbench.backend.BackendRegistry;
import com.agentbench.core.collector.LogCollector;
import com.agentbench.core.events.JobEventBus;
import com.agentbench.core.metrics.SchedulerMetrics;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.AwsAccountConnection;
import com.agentbench.core.model.ConnectionStatus;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.routing.AssumedCredentials;
import com.agentbench.core.routing.CredentialCache;
import com.agentbench.core.routing.DeploymentRouter;
import com.agentbench.core.routing.TierProperties;
import com.agentbench.core.routing.TrustProperties;
import com.agentbench.core.scheduler.JobRunner;
import com.agentbench.core.scheduler.JobStateMachine;
import com.agentbench.core.scheduler.QueueScheduler;
import com.agentbench.core.scheduler.RetryPolicy;
import com.agentbench.core.scheduler.SchedulerProperties;
import com.agentbench.core.service.SubmissionProperties;
import com.agentbench.core.service.TestExecutionService;
import com.agentbench.core.service.UserService;
import com.agentbench.core.store.InMemoryAccountConnectionStore;
import com.agentbench.core.store.InMemoryAgentStore;
import com.agentbench.core.store.InMemoryJobStore;
import com.agentbench.core.store.InMemoryQueueStore;
import com.agentbench.core.store.InMemoryUserStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * The scheduler and the submission service wired over in-memory stores, fake backends and a
 * {@link MutableClock}. With the default direct executors a {@code processQueue()} call runs the
 * claimed jobs to completion on the calling thread.
 */
public class SchedulerHarness {

    public static final String FOUNDATION_MODEL = "anthropic.claude-3-haiku-20240307-v1:0";

    public final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    public final InMemoryQueueStore queue = new InMemoryQueueStore();
    public final InMemoryUserStore userStore = new InMemoryUserStore();
    public final InMemoryJobStore jobs = new InMemoryJobStore(queue, userStore);
    public final InMemoryAgentStore agents = new InMemoryAgentStore();
    public final InMemoryAccountConnectionStore connections = new InMemoryAccountConnectionStore();
    public final JobEventBus eventBus = new JobEventBus();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final SchedulerMetrics metrics = new SchedulerMetrics(meterRegistry);

    public final SchedulerProperties schedulerProperties = new SchedulerProperties();
    public final SubmissionProperties submission = new SubmissionProperties();
    public final TierProperties tiers = new TierProperties();
    public final TrustProperties trust = new TrustProperties();
    public final BackendProperties backendProperties = new BackendProperties();

    public final FakeBackend container = new FakeBackend(ProviderKind.CONTAINER);
    public final FakeBackend runtime = new FakeBackend(ProviderKind.MANAGED_RUNTIME);
    public final BackendRegistry backends = new BackendRegistry(List.of(container, runtime));

    /** Role references passed to the token exchange, in call order. */
    public final List<String> assumedRoles = new CopyOnWriteArrayList<>();

    public final JobStateMachine stateMachine;
    public final RetryPolicy retryPolicy;
    public final LogCollector collector;
    public final CredentialCache credentialCache;
    public final DeploymentRouter router;
    public final UserService users;
    public final JobRunner runner;
    public final QueueScheduler scheduler;
    public final TestExecutionService tests;

    public SchedulerHarness() {
        this(Runnable::run, Runnable::run);
    }

    public SchedulerHarness(Executor workers, Executor dispatchExecutor) {
        this("worker-test", workers, dispatchExecutor);
    }

    public SchedulerHarness(String workerId, Executor workers, Executor dispatchExecutor) {
        schedulerProperties.setWorkerId(workerId);
        schedulerProperties.setBackendPollIntervalMs(1);

        stateMachine = new JobStateMachine(jobs, eventBus, clock);
        retryPolicy = new RetryPolicy(schedulerProperties);
        collector = new LogCollector(jobs, eventBus, clock);
        credentialCache = new CredentialCache(clock, trust);
        router = new DeploymentRouter(tiers, trust, backendProperties, connections,
                (roleArn, externalId, sessionName, durationSeconds) -> {
                    assumedRoles.add(roleArn);
                    return new AssumedCredentials("ASIATEST", "secret", "token",
                            clock.instant().plusSeconds(durationSeconds));
                },
                credentialCache);
        users = new UserService(userStore, clock);
        runner = new JobRunner(jobs, queue, agents, userStore, backends, router, stateMachine, retryPolicy,
                collector, metrics, schedulerProperties, dispatchExecutor, clock);
        scheduler = new QueueScheduler(queue, jobs, runner, backends, schedulerProperties, metrics, eventBus,
                workers, clock);
        tests = new TestExecutionService(jobs, queue, agents, users, router, tiers, stateMachine, collector,
                backends, submission, schedulerProperties, metrics, eventBus, clock);
    }

    // ── Fixtures ────────────────────────────────────────────────────────

    public UserAccount user(String id, Tier tier, int testsThisMonth) {
        return userStore.save(new UserAccount(id, tier, testsThisMonth, clock.instant()));
    }

    /** Agent on a hosted foundation model; freemium runs it on the managed runtime. */
    public Agent foundationAgent(String id, String ownerId) {
        return agents.save(new Agent(id, ownerId, "Math helper",
                new ExecutionArtifact("print('hi')", "boto3\n", null),
                new ProviderConfig(null, FOUNDATION_MODEL, "us-east-1"), "runtime-" + id, false));
    }

    /** Agent on a self-hosted model; always runs in a container. */
    public Agent openAgent(String id, String ownerId) {
        return agents.save(new Agent(id, ownerId, "Local helper",
                new ExecutionArtifact("print('hi')", "requests\n", "FROM python:3.11-slim\n"),
                new ProviderConfig("http://ollama:11434", "llama3.1:8b", null), null, false));
    }

    public AwsAccountConnection connect(String userId, String region) {
        return connections.save(new AwsAccountConnection(userId, "123456789012",
                "arn:aws:iam::123456789012:role/AgentTestRunner", "ab-ext-" + userId, region,
                ConnectionStatus.CONNECTED, clock.instant(), clock.instant()));
    }

    public Job job(String jobId) {
        return jobs.findById(jobId).orElseThrow();
    }

    public void advance(Duration duration) {
        clock.advance(duration);
    }
}
