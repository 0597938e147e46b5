package com.agentbench.core.error;

import com.agentbench.core.model.JobStatus;

/**
 * A status change that is not an edge of the job lifecycle graph, or an operation the
 * current status does not allow.
 */
public class IllegalTransitionException extends AgentBenchException {

    private final JobStatus from;

    public IllegalTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(ErrorKind.ILLEGAL_STATE, null,
                "Job " + jobId + " cannot move from " + from + " to " + to);
        this.from = from;
    }

    public IllegalTransitionException(String jobId, JobStatus from, String message) {
        super(ErrorKind.ILLEGAL_STATE, null, "Job " + jobId + " is " + from + ": " + message);
        this.from = from;
    }

    public JobStatus from() {
        return from;
    }
}
