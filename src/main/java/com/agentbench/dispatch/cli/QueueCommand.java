package com.agentbench.dispatch.cli;

import com.agentbench.core.service.QueueStatus;
import com.agentbench.core.service.TestExecutionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentbench queue
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Show queue load")
@Component
public class QueueCommand implements Runnable {

    private final TestExecutionService testService;

    public QueueCommand(TestExecutionService testService) {
        this.testService = testService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        QueueStatus status = testService.getQueueStatus();
        ConsoleOutput.info("Pending: " + status.pendingCount());
        ConsoleOutput.info("Running: " + status.runningCount() + "/" + status.capacity());
        ConsoleOutput.info("Average wait: " + ConsoleOutput.formatDuration(status.avgWaitMs()));
        if (status.oldestPendingAgeMs() > 0) {
            ConsoleOutput.info("Oldest pending: " + ConsoleOutput.formatDuration(status.oldestPendingAgeMs()));
        }
    }
}
