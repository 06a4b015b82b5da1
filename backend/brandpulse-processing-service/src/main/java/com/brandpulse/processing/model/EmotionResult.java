package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record EmotionResult(
    @JsonProperty("emotions") Map<String, Double> emotions,
    @JsonProperty("top_emotion") String topEmotion
) {
    public static final String NEUTRAL = "neutral";

    public static EmotionResult none() {
        return new EmotionResult(Map.of(), NEUTRAL);
    }
}
