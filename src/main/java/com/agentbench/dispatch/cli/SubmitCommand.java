package com.agentbench.dispatch.cli;

import com.agentbench.core.error.AgentBenchException;
import com.agentbench.core.events.JobEventBus;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.scheduler.SchedulerProperties;
import com.agentbench.core.service.SubmissionResult;
import com.agentbench.core.service.TestExecutionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CLI command: agentbench submit &lt;agent-id&gt; "&lt;query&gt;"
 * <p>
 * Queues a test and, with {@code --wait}, follows its events until it finishes.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a test job")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Parameters(index = "1", description = "Input sent to the agent")
    private String query;

    @Option(names = {"--user", "-u"}, description = "Submitting user", required = true)
    private String userId;

    @Option(names = {"--priority", "-p"}, description = "1 (high) to 3 (low)")
    private Integer priority;

    @Option(names = {"--timeout"}, description = "Timeout in milliseconds")
    private Long timeoutMs;

    @Option(names = {"--wait", "-w"}, description = "Wait for the test to finish and print the result")
    private boolean waitForResult;

    private final TestExecutionService testService;
    private final JobEventBus eventBus;
    private final SchedulerProperties schedulerProperties;

    public SubmitCommand(TestExecutionService testService, JobEventBus eventBus,
                         SchedulerProperties schedulerProperties) {
        this.testService = testService;
        this.eventBus = eventBus;
        this.schedulerProperties = schedulerProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        // subscribe before submitting so no event is missed; the job id is not known yet
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<String> watched = new AtomicReference<>();
        JobEventBus.Subscription subscription = eventBus.subscribeAll(event -> {
            if (!event.jobId().equals(watched.get())) {
                return;
            }
            ConsoleOutput.watchEvent(event.eventType(), String.valueOf(event.payload()));
            if (event.isTerminalStatus()) {
                finished.countDown();
            }
        });

        try {
            SubmissionResult result;
            try {
                result = testService.submitTest(userId, agentId, query, timeoutMs, priority);
            } catch (AgentBenchException e) {
                ConsoleOutput.error("Submission rejected (" + e.kind() + "): " + e.getMessage());
                return 1;
            }
            watched.set(result.jobId());
            ConsoleOutput.success("Queued test " + result.jobId() + " at position " + result.queuePosition()
                    + " (about " + result.estimatedWaitSeconds() + "s)");
            if (!waitForResult) {
                return 0;
            }

            Job job = testService.getTestById(result.jobId());
            long waitMs = job.timeoutMs() + schedulerProperties.getWatchdogGraceMs()
                    + result.estimatedWaitSeconds() * 1000;
            if (!job.status().isTerminal() && !finished.await(waitMs, TimeUnit.MILLISECONDS)) {
                ConsoleOutput.error("Gave up waiting after " + ConsoleOutput.formatDuration(waitMs));
                return 2;
            }
            Job done = testService.getTestById(result.jobId());
            ConsoleOutput.job(done);
            return done.status() == JobStatus.COMPLETED ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Wait interrupted.");
            return 130;
        } finally {
            subscription.unsubscribe();
        }
    }
}
