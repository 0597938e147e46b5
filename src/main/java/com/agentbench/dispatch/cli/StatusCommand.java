package com.agentbench.dispatch.cli;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.model.Job;
import com.agentbench.core.service.TestExecutionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: agentbench status &lt;test-id&gt;
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show a test job")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Test ID")
    private String jobId;

    @Option(names = {"--logs", "-l"}, description = "Print the collected log lines")
    private boolean showLogs;

    private final TestExecutionService testService;

    public StatusCommand(TestExecutionService testService) {
        this.testService = testService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Job job;
        try {
            job = testService.getTestById(jobId);
        } catch (JobNotFoundException e) {
            ConsoleOutput.error("Test not found: " + jobId);
            return;
        }
        ConsoleOutput.job(job);
        if (showLogs && !job.logs().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Logs (" + job.logs().size() + " lines):");
            job.logs().forEach(ConsoleOutput::logLine);
        }
    }
}
