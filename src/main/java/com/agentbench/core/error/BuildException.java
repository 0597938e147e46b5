package com.agentbench.core.error;

/**
 * Building or pushing the execution artifact failed.
 */
public class BuildException extends AgentBenchException {

    public BuildException(String message) {
        super(ErrorKind.BUILD, ErrorStages.BUILD, message);
    }

    public BuildException(String message, Throwable cause) {
        super(ErrorKind.BUILD, ErrorStages.BUILD, message, cause);
    }
}
