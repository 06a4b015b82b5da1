package com.brandpulse.api.service;

import com.brandpulse.processing.model.AttributionMethod;
import com.brandpulse.processing.model.BatchPredictionRequest;
import com.brandpulse.processing.model.BatchPredictionResponse;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.CrisisResult;
import com.brandpulse.processing.model.EmotionResult;
import com.brandpulse.processing.model.PredictionRequest;
import com.brandpulse.processing.model.PredictionResponse;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.model.SentimentResult;
import com.brandpulse.processing.model.TopicResult;
import com.brandpulse.processing.service.PredictionPipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredictionServiceTest {

  private static final Instant AT = Instant.parse("2026-03-01T12:00:00Z");

  @Mock
  private PredictionPipeline pipeline;

  @Mock
  private PredictionStore store;

  @Mock
  private BrandStatsService stats;

  private SimpleMeterRegistry meters;
  private PredictionService service;

  @BeforeEach
  void setUp() {
    meters = new SimpleMeterRegistry();
    service = new PredictionService(pipeline, store, stats, 3, meters);
  }

  private static PredictionResponse scored(String text, String brand) {
    return new PredictionResponse(text, "reddit",
        new SentimentResult(SentimentLabel.NEGATIVE, 0.7, false, 0.1),
        List.of(new BrandSentimentResult(brand, SentimentLabel.NEGATIVE, 0.7, AttributionMethod.DEFAULT)),
        EmotionResult.none(),
        TopicResult.outlier(List.of()),
        CrisisResult.none(),
        AT);
  }

  @Test
  void predictionIsStoredAndCounted() {
    PredictionRequest request = new PredictionRequest("Nike shipping is slow", null, null, null);
    PredictionResponse response = scored("Nike shipping is slow", "Nike");
    when(pipeline.predict(request)).thenReturn(response);
    when(store.save(request, response)).thenReturn("post-1");

    assertThat(service.predict(request)).isSameAs(response);
    verify(stats).record(response);
  }

  @Test
  void storageFailureStillReturnsPrediction() {
    PredictionRequest request = PredictionRequest.of("Nike shipping is slow");
    PredictionResponse response = scored("Nike shipping is slow", "Nike");
    when(pipeline.predict(request)).thenReturn(response);
    when(store.save(request, response)).thenThrow(new DataAccessResourceFailureException("db down"));

    assertThat(service.predict(request)).isSameAs(response);
    assertThat(meters.counter("brandpulse_persist_failures_total").count()).isEqualTo(1.0);
    verify(stats).record(response);
  }

  @Test
  void emptyPlaceholderIsNotStored() {
    PredictionRequest request = PredictionRequest.of("   ");
    PredictionResponse placeholder = scored("", "Nike");
    when(pipeline.predict(request)).thenReturn(placeholder);

    service.predict(request);

    verifyNoInteractions(store, stats);
  }

  @Test
  void batchResultsAreMatchedToPostsPastFailedItems() {
    PredictionRequest first = PredictionRequest.of("Adidas sizing runs small");
    PredictionRequest third = new PredictionRequest("Puma is fine", "Puma", null, null);
    BatchPredictionRequest batch = new BatchPredictionRequest(Arrays.asList(first, null, third), "Adidas");
    PredictionResponse firstScored = scored(first.text(), "Adidas");
    PredictionResponse thirdScored = scored(third.text(), "Puma");
    when(pipeline.predictBatch(batch)).thenReturn(new BatchPredictionResponse(
        List.of(firstScored, thirdScored), 2, AT, List.of(new BatchPredictionResponse.ItemError(1, "post is null"))));
    when(store.save(any(), any())).thenReturn("id");

    BatchPredictionResponse response = service.predictBatch(batch);

    assertThat(response.total()).isEqualTo(2);
    verify(store).save(first.withBrand("Adidas"), firstScored);
    verify(store).save(third, thirdScored);
    verify(stats).record(firstScored);
    verify(stats).record(thirdScored);
  }

  @Test
  void oversizedBatchIsRejectedBeforeScoring() {
    List<PredictionRequest> posts = List.of(
        PredictionRequest.of("a"), PredictionRequest.of("b"), PredictionRequest.of("c"), PredictionRequest.of("d"));

    assertThatThrownBy(() -> service.predictBatch(new BatchPredictionRequest(posts, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("limit is 3");
    verify(pipeline, never()).predictBatch(any());
  }
}
