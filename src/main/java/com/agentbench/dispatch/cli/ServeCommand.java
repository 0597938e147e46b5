package com.agentbench.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentbench serve
 * <p>
 * Starts the REST API and the queue scheduler as a long-running server. The web server is
 * enabled by {@link com.agentbench.AgentBenchApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the agentbench HTTP server and queue workers")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Value("${agentbench.scheduler.worker-id:}")
    private String workerId;

    @Override
    public void run() {
        // only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int actualPort) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("agentbench server running on port " + actualPort
                + (workerId == null || workerId.isBlank() ? "" : " as " + workerId));
        System.out.println();
        System.out.println("  API:     http://localhost:" + actualPort + "/api/v1");
        System.out.println("  Health:  http://localhost:" + actualPort + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
