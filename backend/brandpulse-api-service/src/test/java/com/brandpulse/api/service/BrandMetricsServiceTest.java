package com.brandpulse.api.service;

import com.brandpulse.api.model.BrandMetrics;
import com.brandpulse.api.model.CompetitiveSnapshot;
import com.brandpulse.api.model.HourlyBucket;
import com.brandpulse.api.model.TopicCount;
import com.brandpulse.api.repo.PredictionRecordRepository;
import com.brandpulse.api.repo.SentimentCount;
import com.brandpulse.processing.brand.BrandDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrandMetricsServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final BrandDetector DETECTOR = new BrandDetector("/brands.tsv");

  @Mock
  private PredictionRecordRepository predictions;

  @Mock
  private BrandStatsService stats;

  private BrandMetricsService service;

  @BeforeEach
  void setUp() {
    service = new BrandMetricsService(predictions, stats, DETECTOR, Clock.fixed(NOW, ZoneOffset.UTC), 5);
  }

  private record Row(String brand, String sentiment, long total) implements SentimentCount {
    @Override
    public String getBrand() {
      return brand;
    }

    @Override
    public String getSentiment() {
      return sentiment;
    }

    @Override
    public long getTotal() {
      return total;
    }
  }

  @Test
  void metricsCombineCountsAndRollingStats() {
    when(predictions.countSentimentsForBrand("Nike")).thenReturn(List.of(
        new Row("Nike", "positive", 6), new Row("nike", "negative", 3), new Row("Nike", "neutral", 1)));
    when(predictions.countByBrandIgnoreCaseAndCrisisFlagTrue("Nike")).thenReturn(2L);
    List<HourlyBucket> hourly = List.of(new HourlyBucket(NOW, 6, 3, 1));
    when(stats.hourly("Nike")).thenReturn(hourly);
    when(stats.emotionAverages("Nike")).thenReturn(Map.of("joy", 0.4));
    when(stats.topTopics("Nike", 5)).thenReturn(List.of(new TopicCount("price_value", 3)));

    BrandMetrics metrics = service.metrics("nike");

    assertThat(metrics.brand()).isEqualTo("Nike");
    assertThat(metrics.total()).isEqualTo(10);
    assertThat(metrics.positivePct()).isEqualTo(0.6);
    assertThat(metrics.negativePct()).isEqualTo(0.3);
    assertThat(metrics.crisisPosts()).isEqualTo(2);
    assertThat(metrics.hourly()).isEqualTo(hourly);
    assertThat(metrics.topTopics()).extracting(TopicCount::label).containsExactly("price_value");
  }

  @Test
  void brandWithoutPredictionsIsNotFound() {
    when(predictions.countSentimentsForBrand("Hoka")).thenReturn(List.of());

    assertThatThrownBy(() -> service.metrics("Hoka"))
        .isInstanceOf(BrandNotFoundException.class)
        .hasMessageContaining("Hoka");
  }

  @Test
  void competitiveRanksByPositiveShareThenVolume() {
    when(predictions.countSentimentsByBrand()).thenReturn(List.of(
        new Row("Adidas", "positive", 2), new Row("Adidas", "negative", 8),
        new Row("Nike", "positive", 6), new Row("Nike", "negative", 4),
        new Row("Puma", "positive", 1), new Row("Puma", "negative", 1),
        new Row("nike", "neutral", 0),
        new Row("Reebok", "positive", 5), new Row("Reebok", "neutral", 5)));
    when(stats.activeBrands(Duration.ofHours(24))).thenReturn(3L);

    CompetitiveSnapshot snapshot = service.competitive();

    assertThat(snapshot.rankings()).extracting(CompetitiveSnapshot.BrandRanking::brand)
        .containsExactly("Nike", "Reebok", "Puma", "Adidas");
    assertThat(snapshot.leader()).isEqualTo("Nike");
    assertThat(snapshot.laggard()).isEqualTo("Adidas");
    assertThat(snapshot.activeBrands()).isEqualTo(3);
    assertThat(snapshot.generatedAt()).isEqualTo(NOW);
  }

  @Test
  void competitiveWithoutDataHasNoLeader() {
    when(predictions.countSentimentsByBrand()).thenReturn(List.of());

    CompetitiveSnapshot snapshot = service.competitive();

    assertThat(snapshot.rankings()).isEmpty();
    assertThat(snapshot.leader()).isNull();
    assertThat(snapshot.laggard()).isNull();
  }
}
