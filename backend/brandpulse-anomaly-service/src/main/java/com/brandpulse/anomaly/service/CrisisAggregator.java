package com.brandpulse.anomaly.service;

import com.brandpulse.anomaly.model.CrisisAlert;
import com.brandpulse.anomaly.model.CrisisWindowSnapshot;
import com.brandpulse.anomaly.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-brand negative-rate anomaly detector. Each brand owns an independently locked
 * {@link CrisisWindow}; updates for different brands never contend.
 */
@Service
public class CrisisAggregator {

  private static final Logger log = LoggerFactory.getLogger(CrisisAggregator.class);

  private final ConcurrentMap<String, CrisisWindow> windows = new ConcurrentHashMap<>();

  private final Duration retention;
  private final int minSamples;
  private final double zThreshold;
  private final double absoluteCeiling;
  private final double recoveryPct;
  private final double baselineAlpha;
  private final long baselineMinSamples;
  private final double stddevFloor;
  private final Clock clock;

  private final Counter alertsEmitted;
  private final Counter alertsSuppressed;
  private final Counter staleDropped;

  public CrisisAggregator(@Value("${brandpulse.crisis.window-seconds:3600}") long windowSeconds,
                          @Value("${brandpulse.crisis.min-samples:5}") int minSamples,
                          @Value("${brandpulse.crisis.z-threshold:2.0}") double zThreshold,
                          @Value("${brandpulse.crisis.absolute-ceiling:0.7}") double absoluteCeiling,
                          @Value("${brandpulse.crisis.recovery-pct:0.35}") double recoveryPct,
                          @Value("${brandpulse.crisis.baseline-alpha:0.05}") double baselineAlpha,
                          @Value("${brandpulse.crisis.baseline-min-samples:20}") long baselineMinSamples,
                          @Value("${brandpulse.crisis.stddev-floor:0.01}") double stddevFloor,
                          Clock clock,
                          MeterRegistry metrics) {
    if (windowSeconds <= 0) throw new IllegalArgumentException("window-seconds must be positive");
    if (recoveryPct > absoluteCeiling) {
      throw new IllegalArgumentException("recovery-pct must not exceed absolute-ceiling");
    }
    this.retention = Duration.ofSeconds(windowSeconds);
    this.minSamples = Math.max(1, minSamples);
    this.zThreshold = zThreshold;
    this.absoluteCeiling = absoluteCeiling;
    this.recoveryPct = recoveryPct;
    this.baselineAlpha = baselineAlpha;
    this.baselineMinSamples = baselineMinSamples;
    this.stddevFloor = stddevFloor > 0 ? stddevFloor : 1e-6;
    this.clock = clock;
    this.alertsEmitted = metrics.counter("brandpulse_crisis_alerts_emitted_total");
    this.alertsSuppressed = metrics.counter("brandpulse_crisis_alerts_suppressed_total", "reason", "hysteresis");
    this.staleDropped = metrics.counter("brandpulse_crisis_entries_dropped_total", "reason", "stale");
  }

  public Optional<CrisisAlert> record(String brand, boolean isNegative, Instant timestamp) {
    if (brand == null || brand.isBlank() || timestamp == null) return Optional.empty();
    CrisisWindow window = lockedWindow(brand);
    try {
      Instant newest = window.newest();
      Instant reference = newest != null && newest.isAfter(timestamp) ? newest : timestamp;
      Instant cutoff = reference.minus(retention);
      if (timestamp.isBefore(cutoff)) {
        staleDropped.increment();
        log.debug("Dropped stale crisis entry: brand='{}' at={} cutoff={}", window.brand(), timestamp, cutoff);
        return Optional.empty();
      }

      // evict, then append
      window.evictBefore(cutoff);
      if (window.size() == 0 && window.alertActive()) {
        window.setAlertActive(false);
        log.info("Crisis cleared: brand='{}' window emptied", window.brand());
      }
      window.append(timestamp, isNegative);

      int n = window.size();
      double negativePct = window.negativePct();

      if (window.alertActive() && negativePct < recoveryPct) {
        window.setAlertActive(false);
        log.info("Crisis cleared: brand='{}' negativePct={}", window.brand(), fmt(negativePct));
      }

      // not enough evidence yet
      if (n < minSamples) return Optional.empty();

      // rate and z-score against the baseline
      double mean = window.baselineMean();
      double stddev = window.baselineStddev();
      double z = zScore(negativePct, mean, stddev, stddevFloor);
      boolean baselineTrusted = window.baselineSamples() >= baselineMinSamples;
      boolean zTriggered = baselineTrusted && z > zThreshold;
      boolean ceilingTriggered = negativePct > absoluteCeiling;

      log.debug("Crisis check: brand='{}' posts={} negPct={} mean={} std={} z={}",
          window.brand(), n, fmt(negativePct), fmt(mean), fmt(stddev), fmt(z));

      // decide, with hysteresis
      Optional<CrisisAlert> alert = Optional.empty();
      if (zTriggered || ceilingTriggered) {
        if (window.alertActive()) {
          alertsSuppressed.increment();
        } else {
          window.setAlertActive(true);
          Severity severity = severityFor(z, negativePct, zTriggered, ceilingTriggered);
          alert = Optional.of(buildAlert(window.brand(), severity, negativePct, z, n, timestamp));
          alertsEmitted.increment();
          log.info("Crisis alert: brand='{}' severity={} negPct={} z={} posts={}",
              window.brand(), severity.wireValue(), fmt(negativePct), fmt(z), n);
        }
      }

      // baseline learns only from non-crisis windows
      if (!window.alertActive()) {
        window.updateBaseline(negativePct, baselineAlpha);
      }
      return alert;
    } finally {
      window.lock().unlock();
    }
  }

  /** Loads a historical baseline for a brand; it is trusted immediately. */
  public void seedBaseline(String brand, double mean, double stddev) {
    if (brand == null || brand.isBlank()) throw new IllegalArgumentException("brand is required");
    if (!(mean >= 0.0 && mean <= 1.0)) throw new IllegalArgumentException("baseline mean must be within [0, 1]");
    if (!(stddev >= 0.0)) throw new IllegalArgumentException("baseline stddev must not be negative");
    CrisisWindow window = lockedWindow(brand);
    try {
      window.seedBaseline(mean, stddev, Math.max(1, baselineMinSamples));
    } finally {
      window.lock().unlock();
    }
  }

  public Optional<CrisisWindowSnapshot> snapshot(String brand) {
    if (brand == null) return Optional.empty();
    CrisisWindow window = windows.get(key(brand));
    if (window == null) return Optional.empty();
    window.lock().lock();
    try {
      return Optional.of(new CrisisWindowSnapshot(
          window.brand(),
          window.size(),
          window.negatives(),
          window.negativePct(),
          window.baselineMean(),
          window.baselineStddev(),
          window.baselineSamples(),
          window.alertActive(),
          window.newest()));
    } finally {
      window.lock().unlock();
    }
  }

  /**
   * Re-arms a brand whose alert could not be delivered, so the next qualifying post
   * raises it again instead of being suppressed.
   */
  public void releaseAlert(String brand) {
    if (brand == null) return;
    CrisisWindow window = windows.get(key(brand));
    if (window == null) return;
    window.lock().lock();
    try {
      window.setAlertActive(false);
    } finally {
      window.lock().unlock();
    }
  }

  // Periodic eviction. An emptied window re-arms its alert; it is dropped unless it
  // carries a trusted baseline worth keeping.
  @Scheduled(fixedDelayString = "${brandpulse.crisis.sweep-interval-ms:60000}")
  public void sweep() {
    Instant cutoff = clock.instant().minus(retention);
    int removed = 0;
    int dropped = 0;
    for (Map.Entry<String, CrisisWindow> entry : windows.entrySet()) {
      CrisisWindow window = entry.getValue();
      window.lock().lock();
      try {
        removed += window.evictBefore(cutoff);
        if (window.size() == 0) {
          if (window.alertActive()) {
            window.setAlertActive(false);
            log.info("Crisis cleared: brand='{}' window emptied", window.brand());
          }
          if (window.baselineSamples() < baselineMinSamples && windows.remove(entry.getKey(), window)) {
            dropped++;
          }
        }
      } finally {
        window.lock().unlock();
      }
    }
    if (removed > 0 || dropped > 0) {
      log.debug("crisis sweep evicted={} dropped={} windows={}", removed, dropped, windows.size());
    }
  }

  int windowCount() {
    return windows.size();
  }

  // the sweep may drop a window between lookup and lock; retry on a fresh one
  private CrisisWindow lockedWindow(String brand) {
    String key = key(brand);
    while (true) {
      CrisisWindow window = windows.computeIfAbsent(key, k -> new CrisisWindow(brand.trim()));
      window.lock().lock();
      if (windows.get(key) == window) {
        return window;
      }
      window.lock().unlock();
    }
  }

  static double zScore(double negativePct, double mean, double stddev, double floor) {
    return (negativePct - mean) / Math.max(stddev, floor);
  }

  Severity severityFor(double z, double negativePct, boolean zTriggered, boolean ceilingTriggered) {
    Severity fromZ = null;
    if (zTriggered) {
      double excess = z - zThreshold;
      if (excess >= 1.5) fromZ = Severity.HIGH;
      else if (excess >= 0.5) fromZ = Severity.MEDIUM;
      else fromZ = Severity.LOW;
    }
    Severity fromCeiling = null;
    if (ceilingTriggered) {
      fromCeiling = negativePct >= 0.9 ? Severity.HIGH : Severity.MEDIUM;
    }
    return Severity.max(fromZ, fromCeiling);
  }

  private CrisisAlert buildAlert(String brand, Severity severity, double negativePct, double z, int n, Instant at) {
    String message = String.format(Locale.ROOT,
        "Negative sentiment spike for %s: %.0f%% negative across %d posts (z=%.2f)",
        brand, negativePct * 100.0, n, z);
    return new CrisisAlert(brand, CrisisAlert.TYPE_SPIKE, severity, message, negativePct, z, n, at);
  }

  private static String key(String brand) {
    return brand.trim().toLowerCase(Locale.ROOT);
  }

  private static String fmt(double v) {
    return String.format(Locale.ROOT, "%.3f", v);
  }
}
