package com.agentbench.core.error;

/**
 * The backend is out of capacity. Treated like any other infrastructure failure.
 */
public class QuotaExceededException extends InfraException {

    public QuotaExceededException(String message) {
        super(message);
    }
}
