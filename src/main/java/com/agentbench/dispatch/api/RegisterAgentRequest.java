package com.agentbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Agent registration as produced by the agent builder.
 */
public record RegisterAgentRequest(
        String id,
        @NotBlank String name,
        @JsonProperty("model_id") @NotBlank String modelId,
        @JsonProperty("model_endpoint") String modelEndpoint,
        String region,
        @JsonProperty("agent_code") String agentCode,
        String requirements,
        String dockerfile,
        @JsonProperty("runtime_id") String runtimeId,
        @JsonProperty("is_public") boolean isPublic
) {}
