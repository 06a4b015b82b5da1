package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.SentimentLabel;

public record SentimentPrediction(SentimentLabel label, double score) {
}
