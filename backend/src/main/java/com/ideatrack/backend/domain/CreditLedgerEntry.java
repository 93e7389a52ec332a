package com.ideatrack.backend.domain;

import java.time.Instant;

/**
 * Credit granted to an ancestor because a descendant was validated.
 * Kept apart from the ancestor's own {@link Outcome}.
 */
public record CreditLedgerEntry(
        String submissionId,        // ancestor receiving credit
        String sourceDescendantId,  // validated descendant
        int distance,               // nearest parent = 1
        double creditFraction,
        double creditedAmount,
        Instant appliedAt
) {}
