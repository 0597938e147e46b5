package com.agentbench.core.error;

/**
 * Base class of all scheduler failures.
 */
public abstract class AgentBenchException extends RuntimeException {

    private final ErrorKind kind;
    private final String stage;

    protected AgentBenchException(ErrorKind kind, String stage, String message) {
        super(message);
        this.kind = kind;
        this.stage = stage;
    }

    protected AgentBenchException(ErrorKind kind, String stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Lifecycle stage written to {@code Job.errorStage} when this failure ends a job. */
    public String stage() {
        return stage;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
