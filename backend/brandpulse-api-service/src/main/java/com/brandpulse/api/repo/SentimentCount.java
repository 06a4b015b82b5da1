package com.brandpulse.api.repo;

/** Group-by projection: predictions per brand and sentiment label. */
public interface SentimentCount {
  String getBrand();
  String getSentiment();
  long getTotal();
}
