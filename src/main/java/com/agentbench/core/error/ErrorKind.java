package com.agentbench.core.error;

/**
 * Failure taxonomy. Retryable kinds requeue the job until the retry ceiling is hit;
 * the rest fail the job without consuming an attempt.
 */
public enum ErrorKind {
    VALIDATION(false),
    USAGE_LIMIT_EXCEEDED(false),
    NO_AWS_ACCOUNT_CONNECTED(false),
    BUILD(true),
    INFRA(true),
    TIMEOUT(true),
    CANCELLED(false),
    CLAIM_CONFLICT(false),
    CROSS_ACCOUNT_TRUST(false),
    NOT_FOUND(false),
    ILLEGAL_STATE(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
