package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TopicResult(
    @JsonProperty("topic_id") int topicId,
    @JsonProperty("label") String label,
    @JsonProperty("keywords") List<String> keywords
) {
    public static final int OUTLIER_ID = -1;
    public static final String OUTLIER_LABEL = "outlier";

    public static TopicResult outlier(List<String> keywords) {
        return new TopicResult(OUTLIER_ID, OUTLIER_LABEL, keywords);
    }
}
