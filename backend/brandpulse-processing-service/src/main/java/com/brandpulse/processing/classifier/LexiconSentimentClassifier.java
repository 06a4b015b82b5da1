package com.brandpulse.processing.classifier;

import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.text.Tokenizer;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted-lexicon polarity scorer. Phrases up to the longest lexicon entry are
 * matched greedily; a negator flips the next {@value #NEGATION_SPAN} words and an
 * intensifier scales the word right after it.
 */
public class LexiconSentimentClassifier implements SentimentClassifier {

    static final int NEGATION_SPAN = 3;
    static final double POLAR_CUTOFF = 0.5;
    private static final double NEGATED_DAMPING = 0.75;

    private final Map<String, Double> weights;
    private final Set<String> negators;
    private final Map<String, Double> intensifiers;
    private final int maxPhraseWords;

    public LexiconSentimentClassifier(Map<String, Double> weights, Set<String> negators, Map<String, Double> intensifiers) {
        this.weights = Map.copyOf(weights);
        this.negators = Set.copyOf(negators);
        this.intensifiers = Map.copyOf(intensifiers);
        this.maxPhraseWords = weights.keySet().stream()
            .mapToInt(t -> t.split(" ").length)
            .max()
            .orElse(1);
    }

    @Override
    public SentimentPrediction predict(String text) {
        double total = polarity(Tokenizer.words(text));
        double magnitude = Math.abs(total);
        if (magnitude < POLAR_CUTOFF) {
            return new SentimentPrediction(SentimentLabel.NEUTRAL, Lexicon.round4(1.0 - magnitude));
        }
        double score = 0.5 + 0.5 * Math.tanh(magnitude / 2.0);
        SentimentLabel label = total > 0 ? SentimentLabel.POSITIVE : SentimentLabel.NEGATIVE;
        return new SentimentPrediction(label, Lexicon.round4(score));
    }

    /** Net polarity of a word sequence; also used to spot positive words for sarcasm. */
    double polarity(List<String> words) {
        double total = 0.0;
        int negateLeft = 0;
        double boost = 1.0;

        int i = 0;
        while (i < words.size()) {
            String w = words.get(i);
            if (negators.contains(w) || w.endsWith("n't")) {
                negateLeft = NEGATION_SPAN;
                boost = 1.0;
                i++;
                continue;
            }
            Double scale = intensifiers.get(w);
            if (scale != null) {
                boost = scale;
                i++;
                continue;
            }

            int matched = 1;
            Double weight = null;
            for (int n = Math.min(maxPhraseWords, words.size() - i); n >= 1; n--) {
                weight = weights.get(n == 1 ? w : String.join(" ", words.subList(i, i + n)));
                if (weight != null) {
                    matched = n;
                    break;
                }
            }
            if (weight != null) {
                double v = weight * boost;
                total += negateLeft > 0 ? -v * NEGATED_DAMPING : v;
            }
            boost = 1.0;
            negateLeft = Math.max(0, negateLeft - matched);
            i += matched;
        }
        return total;
    }

    boolean isPositiveWord(String word) {
        Double w = weights.get(word);
        return w != null && w >= 2.0;
    }
}
