package com.brandpulse.api.service;

import com.brandpulse.api.entity.LivePost;
import com.brandpulse.api.entity.PredictionRecord;
import com.brandpulse.api.repo.LivePostRepository;
import com.brandpulse.api.repo.PredictionRecordRepository;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.PredictionRequest;
import com.brandpulse.processing.model.PredictionResponse;
import com.brandpulse.processing.model.TopicResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Writes a scored post and its per-brand judgments in one transaction. */
@Service
public class PredictionStore {

  private final LivePostRepository posts;
  private final PredictionRecordRepository predictions;
  private final ObjectMapper json;
  private final Clock clock;

  public PredictionStore(LivePostRepository posts,
                         PredictionRecordRepository predictions,
                         ObjectMapper json,
                         Clock clock) {
    this.posts = posts;
    this.predictions = predictions;
    this.json = json;
    this.clock = clock;
  }

  /** @return the generated post id */
  @Transactional
  public String save(PredictionRequest request, PredictionResponse response) {
    String postId = UUID.randomUUID().toString();

    LivePost post = new LivePost();
    post.setId(postId);
    post.setPlatform(response.platform());
    post.setBrand(request.brand());
    post.setFullText(request.text());
    post.setCreatedUtc(response.processedAt());
    post.setCollectedAt(clock.instant());
    posts.save(post);

    String emotions = emotionsJson(response);
    TopicResult topic = response.topic();
    List<PredictionRecord> rows = new ArrayList<>(response.brands().size());
    for (BrandSentimentResult brand : response.brands()) {
      PredictionRecord row = new PredictionRecord();
      row.setPostId(postId);
      row.setBrand(brand.brand());
      row.setSentiment(brand.sentiment().wireValue());
      row.setSentimentScore(brand.score());
      row.setSarcastic(response.overall().isSarcastic());
      row.setSarcasmScore(response.overall().sarcasmScore());
      row.setEmotions(emotions);
      row.setTopicId(topic == null ? null : topic.topicId());
      row.setTopicLabel(topic == null ? null : topic.label());
      row.setCrisisFlag(response.crisis().crisisFlag());
      row.setPredictedAt(response.processedAt());
      rows.add(row);
    }
    predictions.saveAll(rows);
    return postId;
  }

  private String emotionsJson(PredictionResponse response) {
    try {
      return json.writeValueAsString(response.emotions().emotions());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize emotions", e);
    }
  }
}
