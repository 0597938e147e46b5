package com.agentbench.backend.container;

import com.agentbench.backend.LogPage;
import com.agentbench.core.error.BackendNotFoundException;
import com.agentbench.core.error.InfraException;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs test tasks as containers on the local Docker daemon. Intended for development: log
 * group and network settings are ignored, and the log cursor is the number of lines already read.
 */
public class DockerContainerTaskClient implements ContainerTaskClient {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerTaskClient.class);

    private final DockerClient dockerClient;

    public DockerContainerTaskClient(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public LaunchedTask launch(TaskLaunchRequest request) {
        // Clean up any stale container with the same name from a previous attempt
        try {
            dockerClient.removeContainerCmd(request.taskName()).withForce(true).exec();
            log.debug("Removed stale container {}", request.taskName());
        } catch (NotFoundException e) {
            log.trace("No stale container named {}", request.taskName());
        }

        var envList = new ArrayList<String>();
        request.environment().forEach((k, v) -> envList.add(k + "=" + v));

        var hostConfig = HostConfig.newHostConfig()
                .withMemory((long) request.memoryMb() * 1024 * 1024)
                .withNanoCPUs((long) (request.cpuUnits() / 1024.0 * 1_000_000_000L))
                .withExtraHosts("host.docker.internal:host-gateway");

        try {
            var response = dockerClient.createContainerCmd(request.image())
                    .withName(request.taskName())
                    .withHostConfig(hostConfig)
                    .withEnv(envList)
                    .exec();
            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Container {} started ({})", request.taskName(), containerId);
            return new LaunchedTask(containerId, request.taskName());
        } catch (Exception e) {
            throw new InfraException("Failed to start container " + request.taskName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public TaskState describe(String taskId) {
        InspectContainerResponse.ContainerState state = inspect(taskId).getState();
        String status = state.getStatus() == null ? "" : state.getStatus();
        return switch (status) {
            case "created" -> new TaskState("PROVISIONING", null, null, null, null);
            case "running", "restarting", "paused" -> new TaskState("RUNNING", null, null, null, null);
            default -> {
                Long exit = state.getExitCodeLong();
                String reason = state.getOOMKilled() != null && state.getOOMKilled()
                        ? "Container killed: out of memory" : state.getError();
                yield new TaskState("STOPPED", exit == null ? null : exit.intValue(),
                        reason == null || reason.isBlank() ? null : reason, null, null);
            }
        };
    }

    @Override
    public void stop(String taskId, String reason) {
        try {
            dockerClient.stopContainerCmd(taskId).withTimeout(10).exec();
            log.info("Stopped container {} ({})", taskId, reason);
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", taskId, e.getMessage());
        }
    }

    @Override
    public LogPage readLogs(String taskId, String logGroup, String logStream, String cursor) {
        int offset = cursor == null ? 0 : Integer.parseInt(cursor);
        boolean running = describe(taskId).isRunning();

        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(taskId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload()));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LogPage.empty(cursor);
        } catch (NotFoundException e) {
            throw new BackendNotFoundException("Container not found: " + taskId);
        }

        List<String> lines = splitLines(sb.toString(), running);
        if (offset >= lines.size()) {
            return LogPage.empty(cursor);
        }
        return new LogPage(lines.subList(offset, lines.size()), String.valueOf(lines.size()));
    }

    /**
     * While the container runs the last line may still be incomplete, so it is held back
     * until a newline arrives.
     */
    static List<String> splitLines(String text, boolean running) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        String last = lines.remove(lines.size() - 1);
        if (!running && !last.isEmpty()) {
            lines.add(last);
        }
        lines.replaceAll(line -> line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        return lines;
    }

    private InspectContainerResponse inspect(String taskId) {
        try {
            return dockerClient.inspectContainerCmd(taskId).exec();
        } catch (NotFoundException e) {
            throw new BackendNotFoundException("Container not found: " + taskId);
        } catch (Exception e) {
            throw new InfraException("Failed to inspect container " + taskId + ": " + e.getMessage(), e);
        }
    }
}
