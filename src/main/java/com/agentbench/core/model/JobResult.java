package com.agentbench.core.model;

/**
 * Outcome fields of a job. All null until the job finishes.
 */
public record JobResult(Boolean success, String response, String error, String errorStage) {

    public static JobResult pending() {
        return new JobResult(null, null, null, null);
    }

    public static JobResult succeeded(String response) {
        return new JobResult(true, response, null, null);
    }

    public static JobResult failed(String error, String errorStage) {
        return new JobResult(false, null, error, errorStage);
    }
}
