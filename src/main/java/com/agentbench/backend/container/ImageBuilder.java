package com.agentbench.backend.container;

import com.agentbench.core.model.ExecutionArtifact;

/**
 * Turns an execution artifact into a runnable image.
 */
public interface ImageBuilder {

    /**
     * Builds (and pushes, when a registry is configured) the image for a job.
     *
     * @throws com.agentbench.core.error.BuildException on any build or push failure
     */
    BuiltImage build(String jobId, ExecutionArtifact artifact);

    record BuiltImage(String imageRef, long buildTimeMs) {}
}
