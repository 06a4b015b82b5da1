package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.EmotionResult;

public interface EmotionClassifier extends TextClassifier<EmotionResult> {
}
