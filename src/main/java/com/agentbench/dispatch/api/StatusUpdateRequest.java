package com.agentbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record StatusUpdateRequest(
        @NotBlank String status,
        String error,
        @JsonProperty("error_stage") String errorStage
) {}
