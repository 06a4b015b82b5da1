package com.brandpulse.api.service;

import com.brandpulse.processing.model.BatchPredictionRequest;
import com.brandpulse.processing.model.BatchPredictionResponse;
import com.brandpulse.processing.model.PredictionRequest;
import com.brandpulse.processing.model.PredictionResponse;
import com.brandpulse.processing.service.PredictionPipeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Scores posts and records them. Storage and stats are downstream of the judgment:
 * when they fail the caller still gets the prediction.
 */
@Service
public class PredictionService {

  private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

  private final PredictionPipeline pipeline;
  private final PredictionStore store;
  private final BrandStatsService stats;
  private final int maxBatchPosts;
  private final Counter persistFailures;

  public PredictionService(PredictionPipeline pipeline,
                           PredictionStore store,
                           BrandStatsService stats,
                           @Value("${brandpulse.batch.max-posts:100}") int maxBatchPosts,
                           MeterRegistry metrics) {
    this.pipeline = pipeline;
    this.store = store;
    this.stats = stats;
    this.maxBatchPosts = maxBatchPosts;
    this.persistFailures = metrics.counter("brandpulse_persist_failures_total");
  }

  public PredictionResponse predict(PredictionRequest request) {
    PredictionResponse response = pipeline.predict(request);
    record(request, response);
    return response;
  }

  public BatchPredictionResponse predictBatch(BatchPredictionRequest batch) {
    if (batch.posts().size() > maxBatchPosts) {
      throw new IllegalArgumentException("batch holds " + batch.posts().size()
          + " posts, the limit is " + maxBatchPosts);
    }
    BatchPredictionResponse response = pipeline.predictBatch(batch);

    // results skip failed items, so walk the posts past the reported error indexes
    Set<Integer> failed = new HashSet<>();
    response.errors().forEach(e -> failed.add(e.index()));
    Iterator<PredictionResponse> results = response.results().iterator();
    for (int i = 0; i < batch.posts().size() && results.hasNext(); i++) {
      if (failed.contains(i)) continue;
      PredictionRequest post = batch.posts().get(i);
      if ((post.brand() == null || post.brand().isBlank()) && batch.brand() != null) {
        post = post.withBrand(batch.brand());
      }
      record(post, results.next());
    }
    return response;
  }

  private void record(PredictionRequest request, PredictionResponse response) {
    if (response.text().isEmpty()) {
      log.debug("Skipping storage of unusable post on platform={}", response.platform());
      return;
    }
    try {
      String postId = store.save(request, response);
      log.debug("Stored post id={} brands={}", postId, response.brands().size());
    } catch (RuntimeException e) {
      persistFailures.increment();
      log.warn("Prediction storage failed (non-fatal): {}", e.getMessage());
    }
    stats.record(response);
  }
}
