package com.brandpulse.anomaly.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "crisis_alerts",
  indexes = {
    @Index(name = "idx_crisis_alerts_triggered_at", columnList = "triggeredAt DESC"),
    @Index(name = "idx_crisis_alerts_brand_triggered_at", columnList = "brand,triggeredAt DESC")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_crisis_alert_brand_triggered", columnNames = {"brand","triggeredAt"})
  }
)
public class CrisisAlertRecord {
  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, length = 100) private String brand;
  @Column(nullable = false, length = 50) private String alertType;
  @Column(length = 20) private String severity;
  @Column(columnDefinition = "text") private String message;
  @Column(nullable = false) private double negativePct;
  @Column(nullable = false) private double zScore;
  @Column(nullable = false) private int windowPosts;
  @Column(nullable = false) private Instant triggeredAt;

  public static CrisisAlertRecord from(CrisisAlert alert) {
    CrisisAlertRecord r = new CrisisAlertRecord();
    r.setBrand(alert.brand());
    r.setAlertType(alert.alertType());
    r.setSeverity(alert.severity() == null ? null : alert.severity().wireValue());
    r.setMessage(alert.message());
    r.setNegativePct(alert.negativePct());
    r.setZScore(alert.zScore());
    r.setWindowPosts(alert.windowPosts());
    r.setTriggeredAt(alert.triggeredAt());
    return r;
  }

  public CrisisAlert toAlert() {
    return new CrisisAlert(brand, alertType, Severity.fromWire(severity), message,
        negativePct, zScore, windowPosts, triggeredAt);
  }

  // getters/setters
  public Long getId() { return id; }
  public String getBrand() { return brand; }
  public void setBrand(String brand) { this.brand = brand; }
  public String getAlertType() { return alertType; }
  public void setAlertType(String alertType) { this.alertType = alertType; }
  public String getSeverity() { return severity; }
  public void setSeverity(String severity) { this.severity = severity; }
  public String getMessage() { return message; }
  public void setMessage(String message) { this.message = message; }
  public double getNegativePct() { return negativePct; }
  public void setNegativePct(double negativePct) { this.negativePct = negativePct; }
  public double getZScore() { return zScore; }
  public void setZScore(double zScore) { this.zScore = zScore; }
  public int getWindowPosts() { return windowPosts; }
  public void setWindowPosts(int windowPosts) { this.windowPosts = windowPosts; }
  public Instant getTriggeredAt() { return triggeredAt; }
  public void setTriggeredAt(Instant triggeredAt) { this.triggeredAt = triggeredAt; }
}
