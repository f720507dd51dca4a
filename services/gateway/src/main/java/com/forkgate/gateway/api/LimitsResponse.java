package com.forkgate.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forkgate.gateway.domain.TierLimits;

/** Body of {@code GET /api/v1/limits}. */
public record LimitsResponse(
        @JsonProperty("access_level") String accessLevel,
        @JsonProperty("execution_limit") long executionLimit,
        @JsonProperty("memory_limit") long memoryLimit) {

    static LimitsResponse from(TierLimits limits) {
        return new LimitsResponse(
                limits.tier().wireName(),
                limits.budget().instructionCeiling(),
                limits.budget().memoryCeiling());
    }
}
