package com.brandpulse.api.model;

import com.brandpulse.anomaly.model.CrisisAlert;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AlertsResponse(
    @JsonProperty("alerts") List<CrisisAlert> alerts,
    @JsonProperty("meta") Meta meta
) {
  public record Meta(
      @JsonProperty("alerts_today") long alertsToday,
      @JsonProperty("page") int page,
      @JsonProperty("limit") int limit
  ) {}
}
