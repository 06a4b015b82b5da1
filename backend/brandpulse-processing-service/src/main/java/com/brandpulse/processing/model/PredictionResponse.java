package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Full structured judgment for one post. Field names, types and cardinalities are a
 * versioned wire contract: additions must be optional, nothing may be renamed.
 */
public record PredictionResponse(
    @JsonProperty("text") String text,
    @JsonProperty("platform") String platform,
    @JsonProperty("overall") SentimentResult overall,
    @JsonProperty("brands") List<BrandSentimentResult> brands,
    @JsonProperty("emotions") EmotionResult emotions,
    @JsonProperty("topic") TopicResult topic,
    @JsonProperty("crisis") CrisisResult crisis,
    @JsonProperty("processed_at") Instant processedAt
) {}
