package com.agentbench.core.error;

/**
 * A claim was held past the claim timeout without the job ever starting, usually because the
 * worker that held it died.
 */
public class StaleClaimException extends AgentBenchException {

    public StaleClaimException(String message) {
        super(ErrorKind.INFRA, ErrorStages.SERVICE, message);
    }
}
