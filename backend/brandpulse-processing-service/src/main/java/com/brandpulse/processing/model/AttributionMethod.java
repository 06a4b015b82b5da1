package com.brandpulse.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttributionMethod {
    /** Local judgment taken around the brand's own mention in a multi-brand text. */
    COMPARATIVE,
    /** Brand inherits the sentence-level sentiment. */
    DEFAULT,
    /** Judgment rewritten by sarcasm inversion or a lost locality tie-break. */
    CONFLICT_RESOLVED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AttributionMethod fromWire(String value) {
        return AttributionMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
