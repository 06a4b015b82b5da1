package com.brandpulse.anomaly.service;

import com.brandpulse.anomaly.model.CrisisAlert;

/** Destination for alerts emitted by {@link CrisisAggregator}. */
public interface CrisisAlertSink {

  /** @return false when the alert was a duplicate and nothing was delivered */
  boolean publish(CrisisAlert alert);
}
