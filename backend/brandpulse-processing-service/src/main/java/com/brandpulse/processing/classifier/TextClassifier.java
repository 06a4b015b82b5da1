package com.brandpulse.processing.classifier;

/**
 * A pre-trained scoring capability. Implementations are loaded once and shared
 * read-only across threads, so {@code predict} must be side-effect free.
 */
@FunctionalInterface
public interface TextClassifier<R> {

    R predict(String text);
}
