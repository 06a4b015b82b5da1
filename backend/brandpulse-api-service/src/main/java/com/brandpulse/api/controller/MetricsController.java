package com.brandpulse.api.controller;

import com.brandpulse.api.model.BrandMetrics;
import com.brandpulse.api.model.CompetitiveSnapshot;
import com.brandpulse.api.service.BrandMetricsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MetricsController {

  private final BrandMetricsService metrics;

  public MetricsController(BrandMetricsService metrics) {
    this.metrics = metrics;
  }

  @GetMapping("/api/metrics/{brand}")
  public BrandMetrics getBrandMetrics(@PathVariable("brand") String brand) {
    return metrics.metrics(brand);
  }

  @GetMapping("/api/competitive")
  public CompetitiveSnapshot getCompetitive() {
    return metrics.competitive();
  }
}
