package com.brandpulse.api.controller;

import com.brandpulse.anomaly.service.CrisisAggregator;
import com.brandpulse.processing.brand.BrandDetector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CrisisControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private CrisisAggregator aggregator;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    aggregator = new CrisisAggregator(3600, 5, 2.0, 0.7, 0.35, 0.05, 20, 0.01,
        Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry());
    mvc = MockMvcBuilders.standaloneSetup(new CrisisController(aggregator, new BrandDetector("/brands.tsv")))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  @Test
  void brandWithoutWindowIsNotFound() throws Exception {
    mvc.perform(get("/api/crisis/nike"))
        .andExpect(status().isNotFound());
  }

  @Test
  void liveWindowIsExposedUnderCanonicalName() throws Exception {
    aggregator.record("Nike", true, NOW);
    aggregator.record("Nike", false, NOW);

    mvc.perform(get("/api/crisis/NIKE"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.brand").value("Nike"))
        .andExpect(jsonPath("$.window_posts").value(2))
        .andExpect(jsonPath("$.negatives").value(1))
        .andExpect(jsonPath("$.negative_pct").value(0.5))
        .andExpect(jsonPath("$.alert_active").value(false));
  }

  @Test
  void baselineCanBeSeeded() throws Exception {
    mvc.perform(post("/api/crisis/adidas/baseline").param("mean", "0.2").param("stddev", "0.1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.brand").value("Adidas"))
        .andExpect(jsonPath("$.baseline_mean").value(0.2))
        .andExpect(jsonPath("$.baseline_samples").value(20));
  }

  @Test
  void outOfRangeBaselineIsBadRequest() throws Exception {
    mvc.perform(post("/api/crisis/adidas/baseline").param("mean", "1.5").param("stddev", "0.1"))
        .andExpect(status().isBadRequest());
    mvc.perform(post("/api/crisis/adidas/baseline").param("mean", "0.2"))
        .andExpect(status().isBadRequest());
  }
}
