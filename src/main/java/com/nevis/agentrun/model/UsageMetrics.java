package com.nevis.agentrun.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UsageMetrics(
    @JsonProperty("input_tokens") int inputTokens,
    @JsonProperty("output_tokens") int outputTokens,
    @JsonProperty("total_tokens") int totalTokens
) {
    public static UsageMetrics of(int inputTokens, int outputTokens) {
        return new UsageMetrics(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
