package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.TopicResult;

public interface TopicClassifier extends TextClassifier<TopicResult> {
}
