package com.agentbench.core.error;

/**
 * The backend no longer knows the handle it was asked about.
 */
public class BackendNotFoundException extends AgentBenchException {

    public BackendNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, ErrorStages.RUNTIME, message);
    }
}
