package com.agentbench.core.error;

/**
 * Bad input, rejected before anything is queued.
 */
public class ValidationException extends AgentBenchException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, ErrorStages.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, ErrorStages.VALIDATION, message, cause);
    }
}
