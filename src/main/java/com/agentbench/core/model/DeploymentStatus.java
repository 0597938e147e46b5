package com.agentbench.core.model;

public enum DeploymentStatus {
    DEPLOYING,
    ACTIVE,
    FAILED,
    DELETED;

    public String value() {
        return name().toLowerCase();
    }
}
