package com.agentbench.core.scheduler;

import com.agentbench.core.error.AgentBenchException;
import com.agentbench.core.model.QueueEntry;
import org.springframework.stereotype.Component;

/**
 * Decides what happens to a queue entry after an attempt fails before the job reached RUNNING.
 * Retryable failures consume an attempt; the attempt that reaches the ceiling abandons the entry.
 * Non-retryable failures end the job without consuming one.
 */
@Component
public class RetryPolicy {

    public enum Decision {
        RETRY,
        ABANDON,
        FAIL
    }

    private final SchedulerProperties properties;

    public RetryPolicy(SchedulerProperties properties) {
        this.properties = properties;
    }

    public Decision decide(QueueEntry entry, AgentBenchException failure) {
        if (!failure.isRetryable()) {
            return Decision.FAIL;
        }
        return entry.attempts() + 1 >= properties.getRetryCeiling() ? Decision.ABANDON : Decision.RETRY;
    }

    public int ceiling() {
        return properties.getRetryCeiling();
    }

    public String abandonMessage(String lastError) {
        return "Test abandoned after " + properties.getRetryCeiling() + " retry attempts: " + lastError;
    }
}
