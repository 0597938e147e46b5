package com.agentbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ConnectAccountRequest(
        @JsonProperty("role_arn") @NotBlank String roleArn,
        @NotBlank String region,
        @JsonProperty("external_id") @NotBlank String externalId
) {}
