package com.agentbench.core.error;

/**
 * The user's tier does not allow another job right now.
 */
public class UsageLimitExceededException extends AgentBenchException {

    public UsageLimitExceededException(String message) {
        super(ErrorKind.USAGE_LIMIT_EXCEEDED, ErrorStages.VALIDATION, message);
    }

    public UsageLimitExceededException(String message, Throwable cause) {
        super(ErrorKind.USAGE_LIMIT_EXCEEDED, ErrorStages.VALIDATION, message, cause);
    }

    public static UsageLimitExceededException concurrent(int maxConcurrent) {
        return new UsageLimitExceededException("Concurrent test limit of " + maxConcurrent
                + " reached. Wait for a running test to finish.");
    }
}
