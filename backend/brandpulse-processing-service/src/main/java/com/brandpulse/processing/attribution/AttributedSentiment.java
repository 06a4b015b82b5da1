package com.brandpulse.processing.attribution;

import com.brandpulse.processing.model.AttributionMethod;
import com.brandpulse.processing.model.BrandSentimentResult;
import com.brandpulse.processing.model.SentimentLabel;

/**
 * Working judgment for one brand mention before conflicts are resolved. Carries the
 * global sentence judgment alongside the brand's own so the two can be reconciled.
 *
 * @param mentionOffset start of the mention in normalized text, or null when the brand
 *                      was never located (requested but undetected, or no positions given)
 * @param fallback      true for a requested brand the text never names
 */
public record AttributedSentiment(
    String brand,
    SentimentLabel label,
    double score,
    AttributionMethod method,
    Integer mentionOffset,
    SentimentLabel globalLabel,
    double globalScore,
    boolean fallback
) {

    /** Inverts both judgments and discounts them by the sarcasm confidence. */
    AttributedSentiment invertedBySarcasm(double sarcasmScore) {
        double keep = 1.0 - sarcasmScore;
        return new AttributedSentiment(
            brand,
            label.inverse(),
            round4(score * keep),
            fallback ? AttributionMethod.DEFAULT : AttributionMethod.CONFLICT_RESOLVED,
            mentionOffset,
            globalLabel.inverse(),
            round4(globalScore * keep),
            fallback);
    }

    AttributedSentiment withGlobalJudgment() {
        return new AttributedSentiment(brand, globalLabel, globalScore, AttributionMethod.CONFLICT_RESOLVED,
            mentionOffset, globalLabel, globalScore, fallback);
    }

    public BrandSentimentResult toResult() {
        return new BrandSentimentResult(brand, label, score, method);
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
