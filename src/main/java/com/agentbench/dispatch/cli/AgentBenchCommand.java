package com.agentbench.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for agentbench.
 */
@Command(
        name = "agentbench",
        mixinStandardHelpOptions = true,
        version = "agentbench 0.1.0",
        description = "Queue and run AI agent test jobs on container and managed-runtime backends",
        subcommands = {
                ServeCommand.class,
                SubmitCommand.class,
                StatusCommand.class,
                QueueCommand.class,
                HistoryCommand.class,
                ResetUsageCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentBenchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
