package com.agentbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for test submission. Timeout and priority fall back to the configured defaults.
 */
public record SubmitTestRequest(
        @JsonProperty("agent_id") @NotBlank String agentId,
        @NotBlank String query,
        @JsonProperty("timeout_ms") Long timeoutMs,
        @Min(1) @Max(3) Integer priority
) {}
