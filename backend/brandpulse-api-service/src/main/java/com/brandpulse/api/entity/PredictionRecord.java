package com.brandpulse.api.entity;

import jakarta.persistence.*;
import java.time.Instant;

/** One row per brand judgment of a post. */
@Entity
@Table(name = "predictions", indexes = {
    @Index(name = "idx_predictions_post_id", columnList = "postId"),
    @Index(name = "idx_predictions_brand_sentiment", columnList = "brand,sentiment"),
    @Index(name = "idx_predictions_crisis_flag", columnList = "crisisFlag")
})
public class PredictionRecord {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, length = 36)
  private String postId;

  @Column(length = 100)
  private String brand;

  @Column(length = 20)
  private String sentiment;

  private double sentimentScore;
  private boolean sarcastic;
  private double sarcasmScore;

  // JSON object of emotion -> score
  @Column(columnDefinition = "text")
  private String emotions;

  private Integer topicId;

  @Column(columnDefinition = "text")
  private String topicLabel;

  private boolean crisisFlag;

  @Column(nullable = false)
  private Instant predictedAt;

  public Long getId() { return id; }
  public String getPostId() { return postId; }
  public void setPostId(String postId) { this.postId = postId; }
  public String getBrand() { return brand; }
  public void setBrand(String brand) { this.brand = brand; }
  public String getSentiment() { return sentiment; }
  public void setSentiment(String sentiment) { this.sentiment = sentiment; }
  public double getSentimentScore() { return sentimentScore; }
  public void setSentimentScore(double sentimentScore) { this.sentimentScore = sentimentScore; }
  public boolean isSarcastic() { return sarcastic; }
  public void setSarcastic(boolean sarcastic) { this.sarcastic = sarcastic; }
  public double getSarcasmScore() { return sarcasmScore; }
  public void setSarcasmScore(double sarcasmScore) { this.sarcasmScore = sarcasmScore; }
  public String getEmotions() { return emotions; }
  public void setEmotions(String emotions) { this.emotions = emotions; }
  public Integer getTopicId() { return topicId; }
  public void setTopicId(Integer topicId) { this.topicId = topicId; }
  public String getTopicLabel() { return topicLabel; }
  public void setTopicLabel(String topicLabel) { this.topicLabel = topicLabel; }
  public boolean isCrisisFlag() { return crisisFlag; }
  public void setCrisisFlag(boolean crisisFlag) { this.crisisFlag = crisisFlag; }
  public Instant getPredictedAt() { return predictedAt; }
  public void setPredictedAt(Instant predictedAt) { this.predictedAt = predictedAt; }
}
