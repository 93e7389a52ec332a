package com.ideatrack.backend.domain;

import java.time.Instant;

/**
 * Non-fatal anomaly that was corrected while processing continued.
 */
public record DataIntegrityWarning(
        String submissionId,
        String code,
        String message,
        Instant detectedAt
) {
    public static final String NEGATIVE_ELAPSED = "NEGATIVE_ELAPSED_TIME";
}
