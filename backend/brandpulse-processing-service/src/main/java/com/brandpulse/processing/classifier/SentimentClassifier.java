package com.brandpulse.processing.classifier;

public interface SentimentClassifier extends TextClassifier<SentimentPrediction> {
}
