package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One inbound post. {@code platform} defaults to reddit and {@code contextPosts}
 * to an empty list; only the trailing three context posts are used.
 */
public record PredictionRequest(
    @JsonProperty("text") String text,
    @JsonProperty("brand") String brand,
    @JsonProperty("platform") String platform,
    @JsonProperty("context_posts") List<String> contextPosts
) {
    public static final String DEFAULT_PLATFORM = "reddit";
    public static final int MAX_CONTEXT_POSTS = 3;

    public PredictionRequest {
        text = text == null ? "" : text;
        platform = platform == null || platform.isBlank() ? DEFAULT_PLATFORM : platform.trim();
        contextPosts = contextPosts == null ? List.of() : List.copyOf(contextPosts.stream()
            .filter(p -> p != null)
            .toList());
    }

    public static PredictionRequest of(String text) {
        return new PredictionRequest(text, null, null, null);
    }

    public PredictionRequest withBrand(String brand) {
        return new PredictionRequest(text, brand, platform, contextPosts);
    }

    /** Trailing slice of the context, oldest dropped first, order preserved. */
    public List<String> trailingContext() {
        int n = contextPosts.size();
        return n <= MAX_CONTEXT_POSTS ? contextPosts : contextPosts.subList(n - MAX_CONTEXT_POSTS, n);
    }
}
