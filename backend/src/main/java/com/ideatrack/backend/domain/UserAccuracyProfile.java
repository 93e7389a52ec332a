package com.ideatrack.backend.domain;

import java.time.Instant;

public record UserAccuracyProfile(
        String ownerId,
        int totalSubmissions,
        int totalValidations,
        double accuracyRate,
        double calibrationScore,
        double reputationScore,
        double meanDaysEarly,
        double directScoreTotal,
        double inheritedCreditTotal,
        Instant lastSubmissionAt,
        Instant lastValidationAt,
        Instant updatedAt
) {

    public static UserAccuracyProfile empty(String ownerId, Instant now) {
        return new UserAccuracyProfile(ownerId, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, null, null, now);
    }
}
