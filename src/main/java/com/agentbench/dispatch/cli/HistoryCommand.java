package com.agentbench.dispatch.cli;

import com.agentbench.core.model.Job;
import com.agentbench.core.service.TestExecutionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: agentbench history &lt;agent-id&gt;
 * <p>
 * Lists the agent's test jobs, newest first, as a table: Test ID | Status | Provider | Query.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List the test jobs of an agent")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final TestExecutionService testService;

    public HistoryCommand(TestExecutionService testService) {
        this.testService = testService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Job> jobs = testService.getDeploymentHistory(agentId, limit);
        if (jobs.isEmpty()) {
            ConsoleOutput.info("No tests found for agent " + agentId + ".");
            return;
        }

        ConsoleOutput.info("Tests of " + agentId + " (" + jobs.size() + "):");
        System.out.println();
        System.out.printf("  %-38s %-10s %-16s %s%n", "TEST ID", "STATUS", "PROVIDER", "QUERY");
        System.out.println("  " + "-".repeat(90));
        for (Job job : jobs) {
            System.out.printf("  %-38s %-10s %-16s %s%n", job.id(), job.status(),
                    job.provider() != null ? job.provider().tag() : "-",
                    ConsoleOutput.truncate(job.query(), 30));
        }
    }
}
