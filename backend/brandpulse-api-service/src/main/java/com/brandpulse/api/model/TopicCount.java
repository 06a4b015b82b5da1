package com.brandpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopicCount(
    @JsonProperty("label") String label,
    @JsonProperty("count") long count
) {}
