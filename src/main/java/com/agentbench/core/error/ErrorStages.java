package com.agentbench.core.error;

/**
 * Values written to {@code Job.errorStage}.
 */
public final class ErrorStages {

    public static final String VALIDATION = "validation";
    public static final String ROUTING = "routing";
    public static final String BUILD = "build";
    public static final String SUBMIT = "submit";
    public static final String RUNTIME = "runtime";
    public static final String TIMEOUT = "timeout";
    public static final String CANCELLED = "cancelled";
    public static final String SERVICE = "service";

    private ErrorStages() {}
}
