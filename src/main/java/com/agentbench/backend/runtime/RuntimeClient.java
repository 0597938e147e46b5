package com.agentbench.backend.runtime;

import java.util.List;

/**
 * Narrow view of the hosted agent runtime service.
 */
public interface RuntimeClient {

    /**
     * Invokes the runtime and blocks until it answers.
     *
     * @throws com.agentbench.core.error.QuotaExceededException when throttled
     * @throws com.agentbench.core.error.InfraException         on any other failure
     */
    Invocation invoke(String runtimeId, String sessionId, Payload payload);

    /**
     * Starts an invocation and returns its id without waiting for the answer.
     */
    String startInvocation(String runtimeId, String sessionId, Payload payload);

    /**
     * @throws com.agentbench.core.error.BackendNotFoundException if the invocation is unknown
     */
    Invocation getInvocation(String runtimeId, String invocationId);

    void stopInvocation(String runtimeId, String invocationId);

    /**
     * @param prompt    input for the agent
     * @param modelId   foundation model to use
     * @param region    region the model is served from
     * @param timeoutMs deadline for the invocation
     */
    record Payload(String prompt, String modelId, String region, long timeoutMs) {}

    /**
     * @param status   "pending", "running", "succeeded" or "failed"
     * @param response agent answer when succeeded
     * @param error    failure reason when failed
     * @param logs     trace lines produced so far
     */
    record Invocation(String status, String response, String error, List<String> logs) {

        public Invocation {
            logs = logs == null ? List.of() : List.copyOf(logs);
        }
    }
}
