package com.brandpulse.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CrisisWindowSnapshot(
    @JsonProperty("brand") String brand,
    @JsonProperty("window_posts") int windowPosts,
    @JsonProperty("negatives") int negatives,
    @JsonProperty("negative_pct") double negativePct,
    @JsonProperty("baseline_mean") double baselineMean,
    @JsonProperty("baseline_stddev") double baselineStddev,
    @JsonProperty("baseline_samples") long baselineSamples,
    @JsonProperty("alert_active") boolean alertActive,
    @JsonProperty("newest_at") Instant newestAt
) {}
