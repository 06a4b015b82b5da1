package com.brandpulse.processing.classifier;

import com.brandpulse.processing.text.TextNormalizer;
import com.brandpulse.processing.text.Tokenizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cue-based sarcasm scorer. Triggered cues combine as a noisy-or; praise words next to
 * a bad-experience word ("love how it broke again") count as one more cue.
 */
public class LexiconSarcasmClassifier implements SarcasmClassifier {

    static final double DECISION_THRESHOLD = 0.5;
    private static final double FLOOR = 0.02;
    private static final double CEILING = 0.99;

    private final Map<Pattern, Double> cues = new LinkedHashMap<>();
    private final Set<String> situations;
    private final double contrastWeight;
    private final LexiconSentimentClassifier sentiment;

    public LexiconSarcasmClassifier(Map<String, Double> cueWeights,
                                    Set<String> situations,
                                    double contrastWeight,
                                    LexiconSentimentClassifier sentiment) {
        cueWeights.forEach((cue, weight) -> cues.put(Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(cue) + "(?![\\p{L}\\p{N}])"), weight));
        this.situations = Set.copyOf(situations);
        this.contrastWeight = contrastWeight;
        this.sentiment = sentiment;
    }

    @Override
    public SarcasmPrediction predict(String text) {
        if (text == null || text.isBlank()) return SarcasmPrediction.none();
        String lowered = TextNormalizer.matchForm(text);

        double keep = 1.0;
        for (Map.Entry<Pattern, Double> cue : cues.entrySet()) {
            if (cue.getKey().matcher(lowered).find()) {
                keep *= 1.0 - cue.getValue();
            }
        }
        if (hasContrast(Tokenizer.words(text))) {
            keep *= 1.0 - contrastWeight;
        }

        double score = Math.min(CEILING, Math.max(FLOOR, 1.0 - keep));
        return new SarcasmPrediction(score >= DECISION_THRESHOLD, Lexicon.round4(score));
    }

    private boolean hasContrast(List<String> words) {
        boolean praise = false;
        boolean trouble = false;
        for (int i = 0; i < words.size(); i++) {
            String w = words.get(i);
            if (!praise && sentiment.isPositiveWord(w)) praise = true;
            if (!trouble && (situations.contains(w)
                || (i + 1 < words.size() && situations.contains(w + " " + words.get(i + 1))))) {
                trouble = true;
            }
            if (praise && trouble) return true;
        }
        return false;
    }
}
