package com.brandpulse.processing.service;

import com.brandpulse.anomaly.model.CrisisAlert;
import com.brandpulse.anomaly.model.Severity;
import com.brandpulse.anomaly.service.CrisisAggregator;
import com.brandpulse.anomaly.service.CrisisAlertSink;
import com.brandpulse.processing.attribution.AttributedSentiment;
import com.brandpulse.processing.attribution.AttributionResolver;
import com.brandpulse.processing.brand.BrandDetector;
import com.brandpulse.processing.classifier.ClassifierRegistry;
import com.brandpulse.processing.classifier.Classifiers;
import com.brandpulse.processing.classifier.ModelLoadException;
import com.brandpulse.processing.classifier.SarcasmPrediction;
import com.brandpulse.processing.classifier.SentimentPrediction;
import com.brandpulse.processing.crisis.CrisisSignalDetector;
import com.brandpulse.processing.model.AttributionMethod;
import com.brandpulse.processing.model.BatchPredictionRequest;
import com.brandpulse.processing.model.BatchPredictionResponse;
import com.brandpulse.processing.model.BrandMention;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.CrisisResult;
import com.brandpulse.processing.model.EmotionResult;
import com.brandpulse.processing.model.PredictionRequest;
import com.brandpulse.processing.model.PredictionResponse;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.model.SentimentResult;
import com.brandpulse.processing.model.TopicResult;
import com.brandpulse.processing.text.TextNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one post through normalization, brand detection, the classifiers, attribution and
 * the crisis stages, and assembles the response. Every stage runs exactly once per call.
 */
@Service
public class PredictionPipeline {

    private static final Logger log = LoggerFactory.getLogger(PredictionPipeline.class);

    private final TextNormalizer normalizer;
    private final BrandDetector brandDetector;
    private final ClassifierRegistry classifiers;
    private final AttributionResolver attribution;
    private final CrisisSignalDetector crisisSignal;
    private final CrisisAggregator aggregator;
    private final CrisisAlertSink alertSink;
    private final Clock clock;

    private final Timer pipelineTimer;
    private final Counter predictions;
    private final Counter emptyText;
    private final Counter batchFailures;
    private final Counter aggregatorFailures;
    private final Counter alertDeliveryFailures;

    public PredictionPipeline(TextNormalizer normalizer,
                              BrandDetector brandDetector,
                              ClassifierRegistry classifiers,
                              AttributionResolver attribution,
                              CrisisSignalDetector crisisSignal,
                              CrisisAggregator aggregator,
                              CrisisAlertSink alertSink,
                              Clock clock,
                              MeterRegistry metrics) {
        this.normalizer = normalizer;
        this.brandDetector = brandDetector;
        this.classifiers = classifiers;
        this.attribution = attribution;
        this.crisisSignal = crisisSignal;
        this.aggregator = aggregator;
        this.alertSink = alertSink;
        this.clock = clock;
        this.pipelineTimer = metrics.timer("brandpulse_pipeline_duration_seconds");
        this.predictions = metrics.counter("brandpulse_predictions_total");
        this.emptyText = metrics.counter("brandpulse_predictions_empty_total");
        this.batchFailures = metrics.counter("brandpulse_batch_item_failures_total");
        this.aggregatorFailures = metrics.counter("brandpulse_aggregator_failures_total");
        this.alertDeliveryFailures = metrics.counter("brandpulse_alert_delivery_failures_total");
    }

    public PredictionResponse predict(PredictionRequest request) {
        return pipelineTimer.record(() -> run(request));
    }

    /**
     * Predicts each post independently. A failed post is reported in {@code errors} and
     * never aborts its siblings; a classifier load failure aborts the whole batch.
     */
    public BatchPredictionResponse predictBatch(BatchPredictionRequest batch) {
        List<PredictionResponse> results = new ArrayList<>(batch.posts().size());
        List<BatchPredictionResponse.ItemError> errors = new ArrayList<>();
        for (int i = 0; i < batch.posts().size(); i++) {
            PredictionRequest post = batch.posts().get(i);
            if (post == null) {
                errors.add(new BatchPredictionResponse.ItemError(i, "post is null"));
                batchFailures.increment();
                continue;
            }
            if ((post.brand() == null || post.brand().isBlank()) && batch.brand() != null) {
                post = post.withBrand(batch.brand());
            }
            try {
                results.add(predict(post));
            } catch (ModelLoadException e) {
                throw e;
            } catch (RuntimeException e) {
                batchFailures.increment();
                log.warn("Batch item {} failed: {}", i, e.getMessage());
                errors.add(new BatchPredictionResponse.ItemError(i, String.valueOf(e.getMessage())));
            }
        }
        return new BatchPredictionResponse(results, results.size(), clock.instant(), errors);
    }

    private PredictionResponse run(PredictionRequest request) {
        Instant now = clock.instant();
        String text = normalizer.normalize(request.text(), request.platform());
        if (text.isEmpty()) {
            emptyText.increment();
            return placeholder(request, now);
        }

        Classifiers models = classifiers.get();
        List<BrandMention> mentions = brandDetector.detectWithPositions(text);
        Set<String> brands = brandDetector.brandsOf(mentions, request.brand());

        SentimentPrediction sentiment = models.sentiment().predict(text);
        SarcasmPrediction sarcasm = models.sarcasm().predictInContext(normalizedContext(request), text);

        List<AttributedSentiment> drafts = attribution.attribute(text, brands, sentiment, sarcasm, mentions);
        List<BrandSentimentResult> brandResults = attribution.resolveConflicts(drafts);

        EmotionResult emotions = models.emotion().predict(text);
        TopicResult topic = models.topic().predict(text);

        SentimentResult overall = new SentimentResult(sentiment.label(), sentiment.score(),
            sarcasm.sarcastic(), sarcasm.score());
        CrisisResult crisis = crisisSignal.detect(overall);
        crisis = recordOutcomes(brandResults, crisis, now);

        predictions.increment();
        log.debug("Predicted platform={} brands={} label={} crisis={}",
            request.platform(), brandResults.size(), overall.label(), crisis.crisisFlag());
        return new PredictionResponse(text, request.platform(), overall, brandResults, emotions, topic, crisis, now);
    }

    /**
     * Feeds every brand outcome to the aggregator. The per-post flag only counts for
     * brands that inherited the sentence judgment. Aggregator or delivery trouble is
     * logged and counted; the prediction stands either way.
     */
    private CrisisResult recordOutcomes(List<BrandSentimentResult> brandResults, CrisisResult perPost, Instant at) {
        CrisisResult crisis = perPost;
        for (BrandSentimentResult result : brandResults) {
            boolean negative = result.sentiment() == SentimentLabel.NEGATIVE
                || (perPost.crisisFlag() && result.method() == AttributionMethod.DEFAULT);
            Optional<CrisisAlert> alert;
            try {
                alert = aggregator.record(result.brand(), negative, at);
            } catch (RuntimeException e) {
                aggregatorFailures.increment();
                log.warn("Crisis aggregation failed for brand='{}' (non-fatal): {}", result.brand(), e.getMessage());
                continue;
            }
            if (alert.isEmpty()) continue;

            try {
                alertSink.publish(alert.get());
            } catch (RuntimeException e) {
                // undelivered, so the next qualifying post must raise it again
                aggregator.releaseAlert(result.brand());
                alertDeliveryFailures.increment();
                log.warn("Crisis alert delivery failed for brand='{}', re-armed: {}", result.brand(), e.getMessage());
            }
            crisis = new CrisisResult(true, Severity.max(crisis.severity(), alert.get().severity()));
        }
        return crisis;
    }

    private List<String> normalizedContext(PredictionRequest request) {
        List<String> context = new ArrayList<>();
        for (String post : request.trailingContext()) {
            String cleaned = normalizer.normalize(post, request.platform());
            if (!cleaned.isEmpty()) context.add(cleaned);
        }
        return context;
    }

    private PredictionResponse placeholder(PredictionRequest request, Instant now) {
        List<BrandSentimentResult> brands = new ArrayList<>();
        if (request.brand() != null && !request.brand().isBlank()) {
            brands.add(new BrandSentimentResult(brandDetector.canonical(request.brand()),
                SentimentLabel.NEUTRAL, 0.0, AttributionMethod.DEFAULT));
        }
        return new PredictionResponse(
            "",
            request.platform(),
            new SentimentResult(SentimentLabel.NEUTRAL, 0.0, false, 0.0),
            brands,
            EmotionResult.none(),
            TopicResult.outlier(List.of()),
            CrisisResult.none(),
            now);
    }
}
