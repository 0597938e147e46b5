package com.agentbench.core.error;

/**
 * Credential exchange was refused, typically an external id mismatch. Never retried.
 */
public class CrossAccountTrustException extends AgentBenchException {

    public CrossAccountTrustException(String message) {
        super(ErrorKind.CROSS_ACCOUNT_TRUST, ErrorStages.ROUTING, message);
    }

    public CrossAccountTrustException(String message, Throwable cause) {
        super(ErrorKind.CROSS_ACCOUNT_TRUST, ErrorStages.ROUTING, message, cause);
    }
}
