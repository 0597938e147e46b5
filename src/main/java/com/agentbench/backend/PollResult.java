package com.agentbench.backend;

import java.util.List;

/**
 * One observation of a running job.
 *
 * @param status       normalized status
 * @param partialLogs  lines observed since the previous poll, for progress display
 * @param response     agent response, set when {@code status} is SUCCEEDED
 * @param error        failure reason, set when {@code status} is FAILED
 * @param memoryUsedMb peak memory if the backend reports it
 * @param cpuUsed      cpu units if the backend reports it
 */
public record PollResult(
        BackendStatus status,
        List<String> partialLogs,
        String response,
        String error,
        Long memoryUsedMb,
        Double cpuUsed
) {

    public PollResult {
        partialLogs = partialLogs == null ? List.of() : List.copyOf(partialLogs);
    }

    public static PollResult pending() {
        return new PollResult(BackendStatus.PENDING, List.of(), null, null, null, null);
    }

    public static PollResult running(List<String> partialLogs) {
        return new PollResult(BackendStatus.RUNNING, partialLogs, null, null, null, null);
    }

    public static PollResult succeeded(String response) {
        return new PollResult(BackendStatus.SUCCEEDED, List.of(), response, null, null, null);
    }

    public static PollResult failed(String error) {
        return new PollResult(BackendStatus.FAILED, List.of(), null, error, null, null);
    }

    public PollResult withUsage(Long memoryMb, Double cpu) {
        return new PollResult(status, partialLogs, response, error, memoryMb, cpu);
    }
}
