package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BrandSentimentResult(
    @JsonProperty("brand") String brand,
    @JsonProperty("sentiment") SentimentLabel sentiment,
    @JsonProperty("score") double score,
    @JsonProperty("method") AttributionMethod method
) {}
