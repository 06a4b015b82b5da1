package com.brandpulse.api.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "live_posts", indexes = {
    @Index(name = "idx_live_posts_brand", columnList = "brand")
})
public class LivePost {
  @Id
  @Column(length = 36)
  private String id;

  @Column(nullable = false, length = 20)
  private String platform;

  @Column(length = 100)
  private String brand;

  @Column(columnDefinition = "text")
  private String fullText;

  private Instant createdUtc;

  @Column(nullable = false)
  private Instant collectedAt;

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }
  public String getPlatform() { return platform; }
  public void setPlatform(String platform) { this.platform = platform; }
  public String getBrand() { return brand; }
  public void setBrand(String brand) { this.brand = brand; }
  public String getFullText() { return fullText; }
  public void setFullText(String fullText) { this.fullText = fullText; }
  public Instant getCreatedUtc() { return createdUtc; }
  public void setCreatedUtc(Instant createdUtc) { this.createdUtc = createdUtc; }
  public Instant getCollectedAt() { return collectedAt; }
  public void setCollectedAt(Instant collectedAt) { this.collectedAt = collectedAt; }
}
