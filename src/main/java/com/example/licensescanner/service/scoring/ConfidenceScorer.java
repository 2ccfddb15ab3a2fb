package com.example.licensescanner.service.scoring;

import com.example.licensescanner.config.ScannerProperties;
import com.example.licensescanner.config.ScannerProperties.Scoring;
import org.springframework.stereotype.Component;

/**
 * Turns extraction signals into a score in {@code [0, 1]}. The score starts from a base value, gains
 * a fixed increment for a structurally validated number and for a textually confirmed region, and a
 * smaller increment per personal field. Ambiguous region inference costs a small penalty.
 */
@Component
public class ConfidenceScorer {

    private final Scoring weights;

    public ConfidenceScorer(ScannerProperties properties) {
        this.weights = properties.scoring();
    }

    public double score(ScoringSignals signals) {
        double score = weights.base();
        if (signals.numberValidated()) {
            score += weights.numberValidated();
        }
        if (signals.regionConfirmed()) {
            score += weights.regionConfirmed();
        }
        if (signals.regionAmbiguous()) {
            score -= weights.ambiguityPenalty();
        }
        score += weights.personalField() * signals.personalFieldCount();
        return clamp(score);
    }

    /**
     * Lowest score a result whose region was confirmed by a printed header (with a validated number)
     * can receive.
     */
    public double headerConfirmedThreshold() {
        return score(new ScoringSignals(true, true, false, 0));
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
