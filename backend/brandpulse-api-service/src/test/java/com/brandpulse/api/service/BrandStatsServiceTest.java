package com.brandpulse.api.service;

import com.brandpulse.api.model.HourlyBucket;
import com.brandpulse.api.model.TopicCount;
import com.brandpulse.processing.model.AttributionMethod;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.CrisisResult;
import com.brandpulse.processing.model.EmotionResult;
import com.brandpulse.processing.model.PredictionResponse;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.model.SentimentResult;
import com.brandpulse.processing.model.TopicResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrandStatsServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:34:56Z");

  @Mock
  private StringRedisTemplate redis;

  @Mock
  private HashOperations<String, Object, Object> hashOps;

  @Mock
  private ZSetOperations<String, String> zsetOps;

  private SimpleMeterRegistry meters;
  private BrandStatsService service;

  @BeforeEach
  void setUp() {
    meters = new SimpleMeterRegistry();
    service = new BrandStatsService(redis, "brands:lastSeen", 172_800, 200, Clock.fixed(NOW, ZoneOffset.UTC), meters);
  }

  private static PredictionResponse response(TopicResult topic) {
    return new PredictionResponse(
        "Nike is worth the price",
        "reddit",
        new SentimentResult(SentimentLabel.POSITIVE, 0.88, false, 0.05),
        List.of(new BrandSentimentResult("Nike", SentimentLabel.POSITIVE, 0.88, AttributionMethod.DEFAULT)),
        new EmotionResult(Map.of("joy", 0.75), "joy"),
        topic,
        CrisisResult.none(),
        NOW);
  }

  @Test
  void recordUpdatesHourlyEmotionTopicAndActivity() {
    when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    when(redis.opsForZSet()).thenReturn(zsetOps);
    when(redis.getExpire(anyString())).thenReturn(-1L);

    service.record(response(new TopicResult(2, "price_value", List.of("price"))));

    verify(hashOps).increment("brand:hourly:nike", "2026-03-01T12:00:00Z|positive", 1L);
    verify(hashOps).increment("brand:emotions:nike", "joy", 0.75);
    verify(hashOps).increment("brand:emotions:nike", "_posts", 1L);
    verify(zsetOps).incrementScore("brand:topics:nike", "price_value", 1.0);
    verify(zsetOps).add("brands:lastSeen", "Nike", (double) NOW.getEpochSecond());
    verify(redis).expire("brand:hourly:nike", Duration.ofSeconds(172_800));
  }

  @Test
  void outlierTopicIsNotCounted() {
    when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    when(redis.opsForZSet()).thenReturn(zsetOps);

    service.record(response(TopicResult.outlier(List.of())));

    verify(zsetOps, never()).incrementScore(anyString(), anyString(), anyDouble());
  }

  @Test
  void redisFailureIsCountedNotThrown() {
    when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    when(hashOps.increment(anyString(), any(), anyLong()))
        .thenThrow(new RedisConnectionFailureException("down"));

    assertThatCode(() -> service.record(response(TopicResult.outlier(List.of())))).doesNotThrowAnyException();
    assertThat(meters.counter("brandpulse_stats_failures_total").count()).isEqualTo(1.0);
  }

  @Test
  void hourlyBucketsAreOrderedAndMalformedFieldsSkipped() {
    Map<Object, Object> entries = new LinkedHashMap<>();
    entries.put("2026-03-01T12:00:00Z|positive", "3");
    entries.put("2026-03-01T12:00:00Z|negative", "1");
    entries.put("2026-03-01T11:00:00Z|neutral", "2");
    entries.put("garbage", "9");
    entries.put("2026-03-01T10:00:00Z|furious", "9");
    when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    when(hashOps.entries("brand:hourly:nike")).thenReturn(entries);

    List<HourlyBucket> buckets = service.hourly("Nike");

    assertThat(buckets).containsExactly(
        new HourlyBucket(Instant.parse("2026-03-01T11:00:00Z"), 0, 0, 2),
        new HourlyBucket(Instant.parse("2026-03-01T12:00:00Z"), 3, 1, 0));
  }

  @Test
  void emotionAveragesDivideByPostCount() {
    Map<Object, Object> entries = new LinkedHashMap<>();
    entries.put("joy", "1.5");
    entries.put("anger", "0.5");
    entries.put("_posts", "3");
    when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
    when(hashOps.entries("brand:emotions:nike")).thenReturn(entries);

    assertThat(service.emotionAverages("nike")).containsExactly(
        Map.entry("anger", 0.1667), Map.entry("joy", 0.5));
  }

  @Test
  void readsFallBackToEmptyWhenRedisIsDown() {
    when(redis.<Object, Object>opsForHash()).thenThrow(new RedisConnectionFailureException("down"));
    when(redis.opsForZSet()).thenThrow(new RedisConnectionFailureException("down"));

    assertThat(service.hourly("Nike")).isEmpty();
    assertThat(service.emotionAverages("Nike")).isEmpty();
    assertThat(service.topTopics("Nike", 5)).isEmpty();
    assertThat(service.activeBrands(Duration.ofHours(24))).isZero();
  }

  @Test
  void topTopicsComeBackHighestFirst() {
    Set<ZSetOperations.TypedTuple<String>> tuples = new LinkedHashSet<>();
    tuples.add(new DefaultTypedTuple<>("price_value", 7.0));
    tuples.add(new DefaultTypedTuple<>("quality_durability", 2.0));
    when(redis.opsForZSet()).thenReturn(zsetOps);
    when(zsetOps.reverseRangeWithScores("brand:topics:nike", 0, 4)).thenReturn(tuples);

    assertThat(service.topTopics("Nike", 5)).containsExactly(
        new TopicCount("price_value", 7), new TopicCount("quality_durability", 2));
  }
}
