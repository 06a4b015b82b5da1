package com.brandpulse.processing.attribution;

import com.brandpulse.processing.classifier.ClassifierRegistry;
import com.brandpulse.processing.classifier.SarcasmPrediction;
import com.brandpulse.processing.classifier.SentimentPrediction;
import com.brandpulse.processing.model.AttributionMethod;
import com.brandpulse.processing.model.BrandMention;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one sentence-level judgment into one judgment per brand.
 *
 * <ul>
 *   <li>A text naming a single brand: the brand inherits the sentence sentiment ({@code default}).</li>
 *   <li>A text naming several brands: each mention is judged on its own neighbourhood
 *       ({@code comparative}). The neighbourhood extends {@code context-chars} around the
 *       mention but stops at the neighbouring brands' mentions, and an explicit
 *       comparison phrase between two mentions ("better than", "worse than") decides
 *       both sides outright.</li>
 *   <li>Confident sarcasm inverts every label and discounts its score by
 *       {@code 1 - sarcasm_score} ({@code conflict_resolved}).</li>
 * </ul>
 *
 * {@link #resolveConflicts(List)} then reconciles local and global judgments and merges
 * duplicate brands.
 */
@Component
public class AttributionResolver {

    private static final Logger log = LoggerFactory.getLogger(AttributionResolver.class);

    static final double MARKER_SCORE = 0.8;

    private final ClassifierRegistry classifiers;
    private final int contextChars;
    private final double sarcasmThreshold;

    public AttributionResolver(ClassifierRegistry classifiers,
                               @Value("${brandpulse.attribution.context-chars:60}") int contextChars,
                               @Value("${brandpulse.attribution.sarcasm-threshold:0.7}") double sarcasmThreshold) {
        this.classifiers = classifiers;
        this.contextChars = contextChars;
        this.sarcasmThreshold = sarcasmThreshold;
    }

    public List<AttributedSentiment> attribute(String text,
                                               Collection<String> detectedBrands,
                                               SentimentPrediction sentiment,
                                               SarcasmPrediction sarcasm,
                                               List<BrandMention> brandPositions) {
        List<BrandMention> mentions = brandPositions == null ? List.of() : brandPositions;
        Map<String, List<Integer>> mentionIdxByBrand = new HashMap<>();
        for (int i = 0; i < mentions.size(); i++) {
            mentionIdxByBrand.computeIfAbsent(key(mentions.get(i).brand()), k -> new ArrayList<>()).add(i);
        }

        long locatedBrands = detectedBrands.stream()
            .filter(b -> mentionIdxByBrand.containsKey(key(b)))
            .count();
        boolean comparative = locatedBrands >= 2;
        Map<Integer, SentimentLabel> markerLabels = comparative ? markerLabels(text, mentions) : Map.of();

        List<AttributedSentiment> drafts = new ArrayList<>();
        for (String brand : detectedBrands) {
            List<Integer> idx = mentionIdxByBrand.getOrDefault(key(brand), List.of());
            Integer firstOffset = idx.isEmpty() ? null : mentions.get(idx.get(0)).start();
            if (!comparative || idx.isEmpty()) {
                drafts.add(new AttributedSentiment(brand, sentiment.label(), sentiment.score(),
                    AttributionMethod.DEFAULT, firstOffset, sentiment.label(), sentiment.score(), idx.isEmpty()));
                continue;
            }
            for (int i : idx) {
                SentimentPrediction local = localSentiment(text, mentions, i, markerLabels);
                drafts.add(new AttributedSentiment(brand, local.label(), local.score(),
                    AttributionMethod.COMPARATIVE, mentions.get(i).start(), sentiment.label(), sentiment.score(), false));
            }
        }

        if (sarcasm != null && sarcasm.sarcastic() && sarcasm.score() > sarcasmThreshold) {
            log.debug("Sarcasm override: score={} brands={}", sarcasm.score(), drafts.size());
            List<AttributedSentiment> inverted = new ArrayList<>(drafts.size());
            for (AttributedSentiment d : drafts) inverted.add(d.invertedBySarcasm(sarcasm.score()));
            return inverted;
        }
        return drafts;
    }

    /**
     * Local and global judgments that disagree in sign are settled by locality: the
     * judgment taken at the brand's mention wins; without an offset the sentence-level
     * judgment wins. Duplicate brands keep their highest-confidence entry, in first
     * detection order.
     */
    public List<BrandSentimentResult> resolveConflicts(List<AttributedSentiment> drafts) {
        Map<String, AttributedSentiment> merged = new LinkedHashMap<>();
        for (AttributedSentiment draft : drafts) {
            AttributedSentiment resolved = resolveAgainstGlobal(draft);
            merged.merge(key(resolved.brand()), resolved, (kept, next) -> next.score() > kept.score() ? next : kept);
        }
        List<BrandSentimentResult> out = new ArrayList<>(merged.size());
        for (AttributedSentiment a : merged.values()) out.add(a.toResult());
        return out;
    }

    private AttributedSentiment resolveAgainstGlobal(AttributedSentiment draft) {
        if (draft.method() != AttributionMethod.COMPARATIVE) return draft;
        if (!draft.label().opposes(draft.globalLabel())) return draft;
        if (draft.mentionOffset() != null) return draft;
        return draft.withGlobalJudgment();
    }

    private SentimentPrediction localSentiment(String text, List<BrandMention> mentions, int i,
                                               Map<Integer, SentimentLabel> markerLabels) {
        SentimentLabel marked = markerLabels.get(i);
        if (marked != null) {
            return new SentimentPrediction(marked, MARKER_SCORE);
        }
        BrandMention m = mentions.get(i);
        int from = Math.max(0, m.start() - contextChars);
        int to = Math.min(text.length(), m.end() + contextChars);
        for (int j = i - 1; j >= 0; j--) {
            if (!sameBrand(mentions.get(j), m)) {
                from = Math.max(from, mentions.get(j).end());
                break;
            }
        }
        for (int j = i + 1; j < mentions.size(); j++) {
            if (!sameBrand(mentions.get(j), m)) {
                to = Math.min(to, mentions.get(j).start());
                break;
            }
        }
        return classifiers.get().sentiment().predict(text.substring(from, to));
    }

    /** Label per mention index decided by a comparison phrase between consecutive mentions. */
    private Map<Integer, SentimentLabel> markerLabels(String text, List<BrandMention> mentions) {
        String lowered = TextNormalizer.matchForm(text);
        Map<Integer, SentimentLabel> labels = new HashMap<>();
        for (int i = 0; i + 1 < mentions.size(); i++) {
            BrandMention left = mentions.get(i);
            BrandMention right = mentions.get(i + 1);
            if (sameBrand(left, right) || right.start() - left.end() > 2 * contextChars) continue;
            Optional<SentimentLabel> leftLabel = ComparativeMarkers.leftLabel(lowered.substring(left.end(), right.start()));
            if (leftLabel.isPresent()) {
                labels.putIfAbsent(i, leftLabel.get());
                labels.putIfAbsent(i + 1, leftLabel.get().inverse());
            }
        }
        return labels;
    }

    private static boolean sameBrand(BrandMention a, BrandMention b) {
        return a.brand().equalsIgnoreCase(b.brand());
    }

    private static String key(String brand) {
        return brand.toLowerCase(Locale.ROOT);
    }
}
