package com.brandpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** Dashboard read model for one brand. Percentages are fractions of {@code total}. */
public record BrandMetrics(
    @JsonProperty("brand") String brand,
    @JsonProperty("positive") long positive,
    @JsonProperty("negative") long negative,
    @JsonProperty("neutral") long neutral,
    @JsonProperty("total") long total,
    @JsonProperty("positive_pct") double positivePct,
    @JsonProperty("negative_pct") double negativePct,
    @JsonProperty("crisis_posts") long crisisPosts,
    @JsonProperty("hourly") List<HourlyBucket> hourly,
    @JsonProperty("emotion_averages") Map<String, Double> emotionAverages,
    @JsonProperty("top_topics") List<TopicCount> topTopics
) {}
