package com.brandpulse.api.service;

import com.brandpulse.api.model.HourlyBucket;
import com.brandpulse.api.model.TopicCount;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.PredictionResponse;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.model.TopicResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-brand rolling stats in Redis: hourly sentiment buckets, emotion sums, topic
 * counts and a last-seen activity index. Redis trouble never fails a prediction;
 * reads fall back to empty results.
 */
@Service
public class BrandStatsService {

  private static final Logger log = LoggerFactory.getLogger(BrandStatsService.class);

  static final String HOURLY_PREFIX = "brand:hourly:";
  static final String EMOTIONS_PREFIX = "brand:emotions:";
  static final String TOPICS_PREFIX = "brand:topics:";
  static final String POSTS_FIELD = "_posts";

  private final StringRedisTemplate redis;
  private final String activityZsetKey;
  private final Duration ttl;
  private final long maxTopics;
  private final Clock clock;
  private final Counter failures;

  public BrandStatsService(StringRedisTemplate redis,
                           @Value("${brandpulse.stats.activity-zset-key:brands:lastSeen}") String activityZsetKey,
                           @Value("${brandpulse.stats.ttl-seconds:172800}") long ttlSeconds,
                           @Value("${brandpulse.stats.max-topics:200}") long maxTopics,
                           Clock clock,
                           MeterRegistry metrics) {
    this.redis = redis;
    this.activityZsetKey = activityZsetKey;
    this.ttl = Duration.ofSeconds(ttlSeconds);
    this.maxTopics = maxTopics;
    this.clock = clock;
    this.failures = metrics.counter("brandpulse_stats_failures_total");
  }

  public void record(PredictionResponse response) {
    String hour = response.processedAt().truncatedTo(ChronoUnit.HOURS).toString();
    TopicResult topic = response.topic();
    Map<String, Double> emotions = response.emotions().emotions();

    for (BrandSentimentResult result : response.brands()) {
      String brand = key(result.brand());
      try {
        String hourlyKey = HOURLY_PREFIX + brand;
        redis.opsForHash().increment(hourlyKey, hour + "|" + result.sentiment().wireValue(), 1L);
        expire(hourlyKey);

        String emotionsKey = EMOTIONS_PREFIX + brand;
        for (Map.Entry<String, Double> e : emotions.entrySet()) {
          redis.opsForHash().increment(emotionsKey, e.getKey(), e.getValue());
        }
        redis.opsForHash().increment(emotionsKey, POSTS_FIELD, 1L);
        expire(emotionsKey);

        if (topic != null && topic.topicId() != TopicResult.OUTLIER_ID) {
          String topicsKey = TOPICS_PREFIX + brand;
          redis.opsForZSet().incrementScore(topicsKey, topic.label(), 1.0);
          trimTopics(topicsKey);
          expire(topicsKey);
        }

        redis.opsForZSet().add(activityZsetKey, result.brand(), response.processedAt().getEpochSecond());
      } catch (Exception e) {
        failures.increment();
        log.warn("Brand stats update failed for brand='{}' (non-fatal): {}", result.brand(), e.getMessage());
      }
    }
  }

  /** Hourly sentiment counts, oldest hour first. */
  public List<HourlyBucket> hourly(String brand) {
    Map<Object, Object> entries = hashEntries(HOURLY_PREFIX + key(brand));
    Map<Instant, long[]> byHour = new TreeMap<>();
    for (Map.Entry<Object, Object> e : entries.entrySet()) {
      String field = String.valueOf(e.getKey());
      int sep = field.lastIndexOf('|');
      if (sep <= 0) continue;
      Instant hour;
      SentimentLabel label;
      try {
        hour = Instant.parse(field.substring(0, sep));
        label = SentimentLabel.fromWire(field.substring(sep + 1));
      } catch (RuntimeException malformed) {
        log.debug("Skipping malformed hourly field '{}' for brand='{}'", field, brand);
        continue;
      }
      long[] counts = byHour.computeIfAbsent(hour, h -> new long[3]);
      counts[label.ordinal()] += parseLong(e.getValue());
    }

    List<HourlyBucket> out = new ArrayList<>(byHour.size());
    byHour.forEach((hour, c) -> out.add(new HourlyBucket(hour,
        c[SentimentLabel.POSITIVE.ordinal()],
        c[SentimentLabel.NEGATIVE.ordinal()],
        c[SentimentLabel.NEUTRAL.ordinal()])));
    return out;
  }

  /** Mean score per emotion over all recorded posts of the brand. */
  public Map<String, Double> emotionAverages(String brand) {
    Map<Object, Object> entries = hashEntries(EMOTIONS_PREFIX + key(brand));
    long posts = parseLong(entries.get(POSTS_FIELD));
    if (posts <= 0) return Map.of();

    Map<String, Double> out = new TreeMap<>();
    for (Map.Entry<Object, Object> e : entries.entrySet()) {
      String emotion = String.valueOf(e.getKey());
      if (POSTS_FIELD.equals(emotion)) continue;
      double sum = parseDouble(e.getValue());
      out.put(emotion, Math.round(sum / posts * 10_000.0) / 10_000.0);
    }
    return out;
  }

  public List<TopicCount> topTopics(String brand, int limit) {
    Set<ZSetOperations.TypedTuple<String>> tuples = null;
    try {
      tuples = redis.opsForZSet().reverseRangeWithScores(TOPICS_PREFIX + key(brand), 0, Math.max(0, limit - 1));
    } catch (Exception e) {
      log.debug("Redis unavailable for topics of brand='{}': {}", brand, e.getMessage());
    }
    if (tuples == null) return List.of();

    List<TopicCount> out = new ArrayList<>(tuples.size());
    for (ZSetOperations.TypedTuple<String> tuple : tuples) {
      if (tuple == null || tuple.getValue() == null) continue;
      out.add(new TopicCount(tuple.getValue(), Math.round(tuple.getScore() == null ? 0.0 : tuple.getScore())));
    }
    return out;
  }

  /** Brands with at least one prediction inside the given look-back window. */
  public long activeBrands(Duration window) {
    long since = clock.instant().minus(window).getEpochSecond();
    try {
      Long count = redis.opsForZSet().count(activityZsetKey, (double) since, Double.POSITIVE_INFINITY);
      return count == null ? 0 : count;
    } catch (Exception e) {
      log.debug("Redis unavailable for active brand count: {}", e.getMessage());
      return 0;
    }
  }

  // Activity entries past the stats TTL are dropped so the index stays bounded
  @Scheduled(fixedDelayString = "${brandpulse.stats.maintenance-interval-ms:600000}")
  void maintenance() {
    long cutoff = clock.instant().minus(ttl).getEpochSecond();
    try {
      Long removed = redis.opsForZSet().removeRangeByScore(activityZsetKey, Double.NEGATIVE_INFINITY, (double) cutoff);
      if (removed != null && removed > 0) {
        log.debug("Maintenance: pruned {} entries from {} older than {}", removed, activityZsetKey, cutoff);
      }
    } catch (Exception e) {
      log.warn("Brand stats maintenance failed: {}", e.getMessage());
    }
  }

  private void trimTopics(String topicsKey) {
    Long size = redis.opsForZSet().zCard(topicsKey);
    if (size != null && maxTopics > 0 && size > maxTopics) {
      redis.opsForZSet().removeRange(topicsKey, 0, size - maxTopics - 1);
    }
  }

  private void expire(String key) {
    Long remaining = redis.getExpire(key);
    if (remaining == null || remaining < 0) {
      redis.expire(key, ttl);
    }
  }

  private Map<Object, Object> hashEntries(String key) {
    try {
      Map<Object, Object> entries = redis.opsForHash().entries(key);
      return entries == null ? Map.of() : new LinkedHashMap<>(entries);
    } catch (Exception e) {
      log.debug("Redis unavailable for {}: {}", key, e.getMessage());
      return Map.of();
    }
  }

  private static long parseLong(Object value) {
    if (value == null) return 0;
    try {
      return Math.round(Double.parseDouble(value.toString()));
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private static double parseDouble(Object value) {
    if (value == null) return 0.0;
    try {
      return Double.parseDouble(value.toString());
    } catch (NumberFormatException e) {
      return 0.0;
    }
  }

  static String key(String brand) {
    return brand.trim().toLowerCase(Locale.ROOT);
  }
}
