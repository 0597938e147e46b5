package com.agentbench.core.logging;

import com.agentbench.core.model.Job;
import org.slf4j.MDC;

/**
 * Utility for managing scheduler-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(Job job) {
        MDC.put("jobId", job.id());
        MDC.put("agentId", job.agentId());
        if (job.provider() != null) {
            MDC.put("provider", job.provider().tag());
        }
    }

    public static void setWorker(String workerId) {
        MDC.put("workerId", workerId);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("agentId");
        MDC.remove("provider");
        MDC.remove("workerId");
    }
}
