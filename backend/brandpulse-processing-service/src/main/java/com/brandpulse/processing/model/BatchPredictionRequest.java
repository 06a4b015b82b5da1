package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Batch envelope; {@code brand} applies to every post that names none itself. */
public record BatchPredictionRequest(
    @JsonProperty("posts") List<PredictionRequest> posts,
    @JsonProperty("brand") String brand
) {
    public BatchPredictionRequest {
        // null items are kept so they can be reported by index
        posts = posts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(posts));
    }
}
