package com.agentbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the retry endpoint. A missing query reuses the original one.
 */
public record RetryTestRequest(
        @JsonProperty("new_query") String newQuery
) {}
