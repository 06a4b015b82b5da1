package com.brandpulse.api.controller;

import com.brandpulse.anomaly.model.CrisisWindowSnapshot;
import com.brandpulse.anomaly.service.CrisisAggregator;
import com.brandpulse.api.service.BrandNotFoundException;
import com.brandpulse.processing.brand.BrandDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Live view of the per-brand crisis windows held in memory by the aggregator. */
@RestController
public class CrisisController {

  private static final Logger log = LoggerFactory.getLogger(CrisisController.class);

  private final CrisisAggregator aggregator;
  private final BrandDetector brands;

  public CrisisController(CrisisAggregator aggregator, BrandDetector brands) {
    this.aggregator = aggregator;
    this.brands = brands;
  }

  @GetMapping("/api/crisis/{brand}")
  public CrisisWindowSnapshot getWindow(@PathVariable("brand") String brand) {
    String name = brands.canonical(brand);
    return aggregator.snapshot(name).orElseThrow(() -> new BrandNotFoundException(name));
  }

  @PostMapping("/api/crisis/{brand}/baseline")
  public CrisisWindowSnapshot seedBaseline(@PathVariable("brand") String brand,
                                           @RequestParam("mean") double mean,
                                           @RequestParam("stddev") double stddev) {
    String name = brands.canonical(brand);
    aggregator.seedBaseline(name, mean, stddev);
    log.info("Seeded crisis baseline: brand='{}' mean={} stddev={}", name, mean, stddev);
    return aggregator.snapshot(name).orElseThrow(() -> new BrandNotFoundException(name));
  }
}
