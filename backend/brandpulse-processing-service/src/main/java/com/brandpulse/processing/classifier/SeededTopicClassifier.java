package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.TopicResult;
import com.brandpulse.processing.text.Tokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns the seeded topic whose seed words occur most often among the content
 * tokens. Texts matching no seed fall into the outlier topic with their most
 * frequent tokens as keywords.
 */
public class SeededTopicClassifier implements TopicClassifier {

    static final int MAX_KEYWORDS = 5;

    private final List<Topic> topics;
    private final Tokenizer tokenizer;

    public SeededTopicClassifier(List<Topic> topics, Tokenizer tokenizer) {
        this.topics = List.copyOf(topics);
        this.tokenizer = tokenizer;
    }

    @Override
    public TopicResult predict(String text) {
        Map<String, Integer> freq = new LinkedHashMap<>();
        for (String token : tokenizer.tokens(text)) {
            freq.merge(token, 1, Integer::sum);
        }
        if (freq.isEmpty()) return TopicResult.outlier(List.of());

        Topic best = null;
        int bestHits = 0;
        for (Topic topic : topics) {
            int hits = 0;
            for (String seed : topic.seeds()) hits += freq.getOrDefault(seed, 0);
            if (hits > bestHits) {
                best = topic;
                bestHits = hits;
            }
        }

        if (best == null) {
            return TopicResult.outlier(topKeywords(freq, null));
        }
        return new TopicResult(best.id(), best.label(), topKeywords(freq, best.seeds()));
    }

    private static List<String> topKeywords(Map<String, Integer> freq, Set<String> restrictTo) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>();
        for (Map.Entry<String, Integer> e : freq.entrySet()) {
            if (restrictTo == null || restrictTo.contains(e.getKey())) entries.add(e);
        }
        // stable sort keeps first-seen order among equal counts
        entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return entries.stream()
            .limit(MAX_KEYWORDS)
            .map(Map.Entry::getKey)
            .toList();
    }

    public record Topic(int id, String label, Set<String> seeds) {}
}
