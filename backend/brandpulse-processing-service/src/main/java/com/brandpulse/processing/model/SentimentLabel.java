package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SentimentLabel {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SentimentLabel fromWire(String value) {
        return SentimentLabel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Positive and negative swap; neutral is its own inverse. */
    public SentimentLabel inverse() {
        return switch (this) {
            case POSITIVE -> NEGATIVE;
            case NEGATIVE -> POSITIVE;
            case NEUTRAL -> NEUTRAL;
        };
    }

    public int sign() {
        return switch (this) {
            case POSITIVE -> 1;
            case NEGATIVE -> -1;
            case NEUTRAL -> 0;
        };
    }

    public boolean opposes(SentimentLabel other) {
        return other != null && sign() * other.sign() < 0;
    }
}
