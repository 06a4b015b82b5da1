package com.brandpulse.processing.classifier;

import java.util.List;

public interface SarcasmClassifier extends TextClassifier<SarcasmPrediction> {

    /** Scores the context posts followed by the current text, joined by spaces. */
    default SarcasmPrediction predictInContext(List<String> contextPosts, String text) {
        return predict(joinContext(contextPosts, text));
    }

    static String joinContext(List<String> contextPosts, String text) {
        if (contextPosts == null || contextPosts.isEmpty()) return text;
        StringBuilder sb = new StringBuilder();
        for (String post : contextPosts) {
            if (post == null || post.isBlank()) continue;
            sb.append(post).append(' ');
        }
        return sb.append(text).toString();
    }
}
