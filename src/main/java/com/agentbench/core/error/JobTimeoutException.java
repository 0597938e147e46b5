package com.agentbench.core.error;

/**
 * The watchdog deadline passed before the backend finished.
 */
public class JobTimeoutException extends AgentBenchException {

    public JobTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, ErrorStages.TIMEOUT, message);
    }

    public JobTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, ErrorStages.TIMEOUT, message, cause);
    }
}
