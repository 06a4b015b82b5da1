package com.brandpulse.anomaly.service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling per-brand state: time-ordered (timestamp, negative) entries plus an
 * exponentially weighted baseline of the negative rate. Not thread-safe on its own;
 * callers hold {@link #lock()} around every read-modify-write sequence.
 */
final class CrisisWindow {

  private final String brand;
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Entry> entries = new ArrayDeque<>();
  private int negatives;

  private double baselineMean;
  private double baselineVariance;
  private long baselineSamples;

  private boolean alertActive;

  CrisisWindow(String brand) {
    this.brand = brand;
  }

  ReentrantLock lock() { return lock; }

  String brand() { return brand; }

  int size() { return entries.size(); }

  int negatives() { return negatives; }

  double negativePct() {
    return entries.isEmpty() ? 0.0 : (double) negatives / entries.size();
  }

  Instant newest() {
    Entry last = entries.peekLast();
    return last == null ? null : last.at();
  }

  /** Drops entries strictly older than {@code cutoff}; returns how many were removed. */
  int evictBefore(Instant cutoff) {
    int removed = 0;
    while (!entries.isEmpty() && entries.peekFirst().at().isBefore(cutoff)) {
      Entry e = entries.pollFirst();
      if (e.negative()) negatives--;
      removed++;
    }
    return removed;
  }

  /** Inserts keeping time order; late arrivals are walked back into place. */
  void append(Instant at, boolean negative) {
    Deque<Entry> later = new ArrayDeque<>();
    while (!entries.isEmpty() && entries.peekLast().at().isAfter(at)) {
      later.push(entries.pollLast());
    }
    entries.addLast(new Entry(at, negative));
    while (!later.isEmpty()) {
      entries.addLast(later.pop());
    }
    if (negative) negatives++;
  }

  double baselineMean() { return baselineMean; }

  double baselineStddev() { return Math.sqrt(Math.max(0.0, baselineVariance)); }

  long baselineSamples() { return baselineSamples; }

  void updateBaseline(double sample, double alpha) {
    if (baselineSamples == 0) {
      baselineMean = sample;
      baselineVariance = 0.0;
    } else {
      double diff = sample - baselineMean;
      double incr = alpha * diff;
      baselineMean += incr;
      baselineVariance = (1 - alpha) * (baselineVariance + diff * incr);
    }
    baselineSamples++;
  }

  void seedBaseline(double mean, double stddev, long samples) {
    baselineMean = mean;
    baselineVariance = stddev * stddev;
    baselineSamples = samples;
  }

  boolean alertActive() { return alertActive; }

  void setAlertActive(boolean alertActive) { this.alertActive = alertActive; }

  private record Entry(Instant at, boolean negative) {}
}
