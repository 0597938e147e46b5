package com.agentbench.dispatch.cli;

import com.agentbench.core.service.UserService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentbench reset-usage
 * <p>
 * Runs the monthly freemium usage reset immediately.
 */
@Command(name = "reset-usage", mixinStandardHelpOptions = true, description = "Reset freemium monthly usage")
@Component
public class ResetUsageCommand implements Runnable {

    private final UserService userService;

    public ResetUsageCommand(UserService userService) {
        this.userService = userService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        int reset = userService.resetMonthlyUsage();
        ConsoleOutput.success("Reset monthly usage for " + reset + " user(s)");
    }
}
