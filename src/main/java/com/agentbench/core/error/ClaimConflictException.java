package com.agentbench.core.error;

/**
 * Another worker won the race for a queue entry. Resolved by re-selecting; never surfaced.
 */
public class ClaimConflictException extends AgentBenchException {

    public ClaimConflictException(String entryId) {
        super(ErrorKind.CLAIM_CONFLICT, null, "Queue entry " + entryId + " was claimed by another worker");
    }
}
