package com.ideatrack.backend.domain;

public record AccuracyScore(
        double daysElapsed,
        double earlyBirdMultiplier,
        double calibrationPenalty,
        double accuracyScore,
        boolean elapsedClamped
) {}
