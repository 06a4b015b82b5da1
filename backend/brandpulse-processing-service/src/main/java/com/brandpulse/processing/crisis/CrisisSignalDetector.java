package com.brandpulse.processing.crisis;

import com.brandpulse.anomaly.model.Severity;
import com.brandpulse.processing.model.CrisisResult;
import com.brandpulse.processing.model.SentimentLabel;
import com.brandpulse.processing.model.SentimentResult;
import org.springframework.stereotype.Component;

/**
 * Stateless per-post gate: a confidently negative post is flagged high. Windowed
 * anomaly detection lives in the aggregator, which consumes this flag.
 */
@Component
public class CrisisSignalDetector {

    public static final double NEGATIVE_SCORE_THRESHOLD = 0.85;

    public CrisisResult detect(SentimentResult overall) {
        if (overall == null) return CrisisResult.none();
        boolean flagged = overall.label() == SentimentLabel.NEGATIVE && overall.score() > NEGATIVE_SCORE_THRESHOLD;
        return flagged ? new CrisisResult(true, Severity.HIGH) : CrisisResult.none();
    }
}
