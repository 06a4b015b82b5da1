package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record BatchPredictionResponse(
    @JsonProperty("results") List<PredictionResponse> results,
    @JsonProperty("total") int total,
    @JsonProperty("processed_at") Instant processedAt,
    @JsonProperty("errors") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ItemError> errors
) {
    public record ItemError(
        @JsonProperty("index") int index,
        @JsonProperty("message") String message
    ) {}
}
