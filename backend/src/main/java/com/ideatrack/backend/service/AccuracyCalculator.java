package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.AccuracyScore;
import com.ideatrack.backend.error.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Pure scoring functions.
 * <ul>
 *   <li>early-bird multiplier: {@code min(5, 1 + days / 365)}</li>
 *   <li>calibration penalty: {@code |confidence - result| * 0.5}, zero when confidence is undeclared</li>
 *   <li>accuracy score: {@code result * multiplier - penalty}, always within [-0.5, 5.0]</li>
 * </ul>
 */
@Component
public class AccuracyCalculator {

    public static final double MAX_EARLY_BIRD_MULTIPLIER = 5.0;
    public static final double DAYS_PER_YEAR = 365.0;
    public static final double CALIBRATION_WEIGHT = 0.5;

    public double earlyBirdMultiplier(double daysElapsed) {
        double days = Math.max(0.0, daysElapsed);
        return Math.min(MAX_EARLY_BIRD_MULTIPLIER, 1.0 + days / DAYS_PER_YEAR);
    }

    public double calibrationPenalty(Double confidence, double result) {
        if (confidence == null) return 0.0;
        return Math.abs(confidence - result) * CALIBRATION_WEIGHT;
    }

    /**
     * @param daysElapsed negative values (validation before submission) are clamped to 0 and flagged
     */
    public AccuracyScore score(double result, Double confidence, double daysElapsed) {
        Scores.requireUnit("result", result);
        Scores.requireUnit("confidence", confidence);
        if (Double.isNaN(daysElapsed)) {
            throw new ValidationException("daysElapsed must be a number");
        }

        boolean clamped = daysElapsed < 0.0;
        double days = clamped ? 0.0 : daysElapsed;
        double multiplier = earlyBirdMultiplier(days);
        double penalty = calibrationPenalty(confidence, result);
        return new AccuracyScore(days, multiplier, penalty, result * multiplier - penalty, clamped);
    }
}
