package com.brandpulse.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Severity fromWire(String value) {
    if (value == null || value.isBlank()) return null;
    return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  /** Null-tolerant maximum; null stands for "no severity". */
  public static Severity max(Severity a, Severity b) {
    if (a == null) return b;
    if (b == null) return a;
    return a.compareTo(b) >= 0 ? a : b;
  }
}
