package com.agentbench.core.error;

public class JobNotFoundException extends AgentBenchException {

    public JobNotFoundException(String what, String id) {
        super(ErrorKind.NOT_FOUND, null, what + " not found: " + id);
    }
}
