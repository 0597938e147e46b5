package com.agentbench.core.model;

/**
 * Source material the container path builds an image from.
 *
 * @param agentCode    agent program source
 * @param requirements dependency manifest
 * @param dockerfile   container descriptor
 */
public record ExecutionArtifact(String agentCode, String requirements, String dockerfile) {

    public static ExecutionArtifact empty() {
        return new ExecutionArtifact("", "", "");
    }
}
