package com.ideatrack.backend.domain;

import java.time.Instant;

/**
 * Live validation result of one submission. Re-validation replaces it under the same id.
 */
public record Outcome(
        String id,
        String submissionId,
        double result,              // 0.0 = completely wrong, 1.0 = completely right
        String validationSource,
        String validationUrl,
        String validationNotes,
        Instant validatedAt,

        // scoring breakdown
        Double confidenceAtSubmission,
        double daysElapsed,
        double earlyBirdMultiplier,
        double calibrationPenalty,
        double accuracyScore
) {}
