package com.brandpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HourlyBucket(
    @JsonProperty("hour") Instant hour,
    @JsonProperty("positive") long positive,
    @JsonProperty("negative") long negative,
    @JsonProperty("neutral") long neutral
) {}
