package com.brandpulse.api.controller;

import com.brandpulse.anomaly.model.Severity;
import com.brandpulse.api.model.AlertsResponse;
import com.brandpulse.api.service.AlertQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;

@RestController
public class AlertsController {

  private final AlertQueryService alerts;

  public AlertsController(AlertQueryService alerts) {
    this.alerts = alerts;
  }

  @GetMapping("/api/alerts")
  public AlertsResponse getAlerts(
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "limit", defaultValue = "20") int limit,
      @RequestParam(name = "brand", required = false) String brand,
      @RequestParam(name = "severity", required = false) String severityStr,
      @RequestParam(name = "since", required = false) String sinceStr
  ) {
    Severity severity;
    try {
      severity = Severity.fromWire(severityStr);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("severity must be one of low, medium, high");
    }
    Instant since = null;
    if (sinceStr != null && !sinceStr.isBlank()) {
      try {
        since = Instant.parse(sinceStr.trim());
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("since must be an ISO-8601 instant, e.g. 2026-03-01T00:00:00Z");
      }
    }
    return alerts.latest(page, limit, brand, severity, since);
  }
}
