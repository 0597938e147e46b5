package com.agentbench.core.events;

import com.agentbench.core.model.JobStatus;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a job's lifecycle, used by the CLI watch mode and by the queue trigger.
 *
 * @param eventType event type, e.g. "job.queued", "job.status", "job.logs"
 * @param jobId     the job this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record JobEvent(
        String eventType,
        String jobId,
        Map<String, Object> payload,
        Instant timestamp
) {

    public static final String QUEUED = "job.queued";
    public static final String STATUS = "job.status";
    public static final String PROGRESS = "job.progress";

    /** True for a status event announcing COMPLETED, FAILED, ABANDONED or ARCHIVED. */
    public boolean isTerminalStatus() {
        if (!STATUS.equals(eventType) || payload == null || payload.get("status") == null) {
            return false;
        }
        return JobStatus.valueOf(String.valueOf(payload.get("status"))).isTerminal();
    }
}
