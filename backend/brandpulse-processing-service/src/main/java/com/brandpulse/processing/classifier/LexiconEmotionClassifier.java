package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.EmotionResult;
import com.brandpulse.processing.text.Tokenizer;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Word-to-emotion lexicon. Each emotion scores {@code 1 - e^(-0.7 * hits)}; only
 * emotions at or above the threshold are reported, strongest first.
 */
public class LexiconEmotionClassifier implements EmotionClassifier {

    private static final double HIT_RATE = 0.7;

    private final Map<String, String> emotionByWord;
    private final double threshold;

    public LexiconEmotionClassifier(Map<String, String> emotionByWord, double threshold) {
        this.emotionByWord = Map.copyOf(emotionByWord);
        this.threshold = threshold;
    }

    @Override
    public EmotionResult predict(String text) {
        Map<String, Integer> hits = new TreeMap<>();
        for (String w : Tokenizer.words(text)) {
            String emotion = emotionByWord.get(w);
            if (emotion != null) hits.merge(emotion, 1, Integer::sum);
        }

        Map<String, Double> kept = new LinkedHashMap<>();
        hits.entrySet().stream()
            .map(e -> Map.entry(e.getKey(), Lexicon.round4(1.0 - Math.exp(-HIT_RATE * e.getValue()))))
            .filter(e -> e.getValue() >= threshold)
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .forEach(e -> kept.put(e.getKey(), e.getValue()));

        if (kept.isEmpty()) return EmotionResult.none();
        return new EmotionResult(kept, kept.keySet().iterator().next());
    }
}
