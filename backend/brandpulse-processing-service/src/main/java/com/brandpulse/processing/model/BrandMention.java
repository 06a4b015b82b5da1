package com.brandpulse.processing.model;

/** A located brand reference; offsets index into the normalized text, end exclusive. */
public record BrandMention(String brand, int start, int end) {
    public BrandMention {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid mention span [" + start + "," + end + ")");
        }
    }
}
