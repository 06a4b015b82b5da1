package com.brandpulse.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Anomaly event raised by the crisis aggregator when a brand's negative rate spikes.
 * Field names follow the persisted crisis_alerts record.
 */
public record CrisisAlert(
    @JsonProperty("brand") String brand,
    @JsonProperty("alert_type") String alertType,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("message") String message,
    @JsonProperty("negative_pct") double negativePct,
    @JsonProperty("z_score") double zScore,
    @JsonProperty("window_posts") int windowPosts,
    @JsonProperty("triggered_at") Instant triggeredAt
) {
  public static final String TYPE_SPIKE = "spike";
}
