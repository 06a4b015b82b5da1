package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.EmotionResult;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.model.TopicResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassifierRegistryTest {

    private static Classifiers stubs() {
        return new Classifiers(
            text -> new SentimentPrediction(SentimentLabel.NEUTRAL, 0.5),
            text -> SarcasmPrediction.none(),
            text -> EmotionResult.none(),
            text -> TopicResult.outlier(List.of()));
    }

    @Test
    void concurrentFirstCallsLoadOnce() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        ClassifierRegistry registry = new ClassifierRegistry(() -> {
            loads.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return stubs();
        });

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Classifiers>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return registry.get();
                }));
            }
            start.countDown();

            Classifiers first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Classifiers> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loads).hasValue(1);
        assertThat(registry.isLoaded()).isTrue();
    }

    @Test
    void loadFailureSurfacesAsModelLoadExceptionAndIsRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ClassifierRegistry registry = new ClassifierRegistry(() -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("disk gone");
            return stubs();
        });

        assertThatThrownBy(registry::get)
            .isInstanceOf(ModelLoadException.class)
            .hasRootCauseMessage("disk gone");
        assertThat(registry.isLoaded()).isFalse();

        assertThat(registry.get()).isNotNull();
        assertThat(attempts).hasValue(2);
    }

    @Test
    void modelLoadExceptionPassesThroughUnwrapped() {
        ModelLoadException failure = new ModelLoadException("missing /models/topics.tsv");
        ClassifierRegistry registry = new ClassifierRegistry(() -> {
            throw failure;
        });

        assertThatThrownBy(registry::get).isSameAs(failure);
    }

    @Test
    void loaderReturningNothingIsFatal() {
        ClassifierRegistry registry = new ClassifierRegistry(() -> null);

        assertThatThrownBy(registry::get).isInstanceOf(ModelLoadException.class);
    }
}
