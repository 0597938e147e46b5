package com.agentbench.core.error;

/**
 * The user cancelled the job.
 */
public class CancelledException extends AgentBenchException {

    public CancelledException(String message) {
        super(ErrorKind.CANCELLED, ErrorStages.CANCELLED, message);
    }

    public CancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, ErrorStages.CANCELLED, message, cause);
    }
}
