package com.brandpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Cross-brand ranking by positive share, best first. */
public record CompetitiveSnapshot(
    @JsonProperty("rankings") List<BrandRanking> rankings,
    @JsonProperty("leader") String leader,
    @JsonProperty("laggard") String laggard,
    @JsonProperty("active_brands") long activeBrands,
    @JsonProperty("generated_at") Instant generatedAt
) {
  public record BrandRanking(
      @JsonProperty("brand") String brand,
      @JsonProperty("positive") long positive,
      @JsonProperty("negative") long negative,
      @JsonProperty("neutral") long neutral,
      @JsonProperty("total") long total,
      @JsonProperty("positive_pct") double positivePct,
      @JsonProperty("negative_pct") double negativePct
  ) {}
}
