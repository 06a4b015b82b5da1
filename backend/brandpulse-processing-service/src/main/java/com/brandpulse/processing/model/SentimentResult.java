package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SentimentResult(
    @JsonProperty("label") SentimentLabel label,
    @JsonProperty("score") double score,
    @JsonProperty("is_sarcastic") boolean isSarcastic,
    @JsonProperty("sarcasm_score") double sarcasmScore
) {}
