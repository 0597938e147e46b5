package com.agentbench.core.service;

import com.agentbench.core.model.JobStatus;

/**
 * What a caller gets back from a submission.
 *
 * @param jobId                new job id
 * @param status               always QUEUED
 * @param queuePosition        1-based position in selection order at submission time
 * @param estimatedWaitSeconds rough wait derived from the position
 */
public record SubmissionResult(String jobId, JobStatus status, long queuePosition, long estimatedWaitSeconds) {
}
