package com.agentbench.core.error;

/**
 * A tier that runs in the user's own account has no connected trust record.
 */
public class NoAwsAccountConnectedException extends AgentBenchException {

    public NoAwsAccountConnectedException(String message) {
        super(ErrorKind.NO_AWS_ACCOUNT_CONNECTED, ErrorStages.ROUTING, message);
    }

    public NoAwsAccountConnectedException(String message, Throwable cause) {
        super(ErrorKind.NO_AWS_ACCOUNT_CONNECTED, ErrorStages.ROUTING, message, cause);
    }
}
