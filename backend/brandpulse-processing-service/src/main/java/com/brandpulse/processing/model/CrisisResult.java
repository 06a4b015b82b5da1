package com.brandpulse.processing.model;

import com.brandpulse.anomaly.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-post crisis signal; {@code severity} is null when nothing was flagged. */
public record CrisisResult(
    @JsonProperty("crisis_flag") boolean crisisFlag,
    @JsonProperty("severity") Severity severity
) {
    public static CrisisResult none() {
        return new CrisisResult(false, null);
    }
}
