package com.agentbench.core.error;

/**
 * The backend could not accept or report on a job.
 */
public class InfraException extends AgentBenchException {

    public InfraException(String message) {
        super(ErrorKind.INFRA, ErrorStages.SUBMIT, message);
    }

    public InfraException(String message, Throwable cause) {
        super(ErrorKind.INFRA, ErrorStages.SUBMIT, message, cause);
    }
}
