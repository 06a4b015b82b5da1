package com.brandpulse.api.service;

import com.brandpulse.api.model.BrandMetrics;
import com.brandpulse.api.model.CompetitiveSnapshot;
import com.brandpulse.api.repo.PredictionRecordRepository;
import com.brandpulse.api.repo.SentimentCount;
import com.brandpulse.processing.brand.BrandDetector;
import com.brandpulse.processing.model.SentimentLabel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class BrandMetricsService {

  private static final Comparator<CompetitiveSnapshot.BrandRanking> RANKING = Comparator
      .comparingDouble(CompetitiveSnapshot.BrandRanking::positivePct).reversed()
      .thenComparing(Comparator.comparingLong(CompetitiveSnapshot.BrandRanking::total).reversed())
      .thenComparing(CompetitiveSnapshot.BrandRanking::brand);

  private final PredictionRecordRepository predictions;
  private final BrandStatsService stats;
  private final BrandDetector brands;
  private final Clock clock;
  private final int topTopics;

  public BrandMetricsService(PredictionRecordRepository predictions,
                             BrandStatsService stats,
                             BrandDetector brands,
                             Clock clock,
                             @Value("${brandpulse.stats.top-topics:5}") int topTopics) {
    this.predictions = predictions;
    this.stats = stats;
    this.brands = brands;
    this.clock = clock;
    this.topTopics = topTopics;
  }

  public BrandMetrics metrics(String brand) {
    if (brand == null || brand.isBlank()) throw new IllegalArgumentException("brand is required");
    String name = brands.canonical(brand);
    List<SentimentCount> rows = predictions.countSentimentsForBrand(name);
    if (rows.isEmpty()) throw new BrandNotFoundException(name);

    Tally tally = new Tally(name);
    rows.forEach(tally::add);
    return new BrandMetrics(
        name,
        tally.positive,
        tally.negative,
        tally.neutral,
        tally.total(),
        tally.pct(tally.positive),
        tally.pct(tally.negative),
        predictions.countByBrandIgnoreCaseAndCrisisFlagTrue(name),
        stats.hourly(name),
        stats.emotionAverages(name),
        stats.topTopics(name, topTopics));
  }

  public CompetitiveSnapshot competitive() {
    Map<String, Tally> byBrand = new LinkedHashMap<>();
    for (SentimentCount row : predictions.countSentimentsByBrand()) {
      if (row.getBrand() == null) continue;
      byBrand.computeIfAbsent(row.getBrand().toLowerCase(Locale.ROOT), k -> new Tally(row.getBrand())).add(row);
    }

    List<CompetitiveSnapshot.BrandRanking> rankings = new ArrayList<>(byBrand.size());
    for (Tally t : byBrand.values()) {
      rankings.add(new CompetitiveSnapshot.BrandRanking(t.brand, t.positive, t.negative, t.neutral,
          t.total(), t.pct(t.positive), t.pct(t.negative)));
    }
    rankings.sort(RANKING);

    String leader = rankings.isEmpty() ? null : rankings.get(0).brand();
    String laggard = rankings.isEmpty() ? null : rankings.get(rankings.size() - 1).brand();
    return new CompetitiveSnapshot(rankings, leader, laggard, stats.activeBrands(Duration.ofHours(24)), clock.instant());
  }

  private static final class Tally {
    private final String brand;
    private long positive;
    private long negative;
    private long neutral;

    Tally(String brand) {
      this.brand = brand;
    }

    void add(SentimentCount row) {
      SentimentLabel label;
      try {
        label = SentimentLabel.fromWire(row.getSentiment());
      } catch (RuntimeException unknown) {
        return;
      }
      switch (label) {
        case POSITIVE -> positive += row.getTotal();
        case NEGATIVE -> negative += row.getTotal();
        case NEUTRAL -> neutral += row.getTotal();
      }
    }

    long total() {
      return positive + negative + neutral;
    }

    double pct(long part) {
      long total = total();
      return total == 0 ? 0.0 : Math.round((double) part / total * 10_000.0) / 10_000.0;
    }
  }
}
