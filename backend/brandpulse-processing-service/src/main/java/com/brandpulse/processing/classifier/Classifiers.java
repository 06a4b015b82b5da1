package com.brandpulse.processing.classifier;

import java.util.Objects;

public record Classifiers(
    SentimentClassifier sentiment,
    SarcasmClassifier sarcasm,
    EmotionClassifier emotion,
    TopicClassifier topic
) {
    public Classifiers {
        Objects.requireNonNull(sentiment, "sentiment");
        Objects.requireNonNull(sarcasm, "sarcasm");
        Objects.requireNonNull(emotion, "emotion");
        Objects.requireNonNull(topic, "topic");
    }
}
