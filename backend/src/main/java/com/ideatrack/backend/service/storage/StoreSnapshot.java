package com.ideatrack.backend.service.storage;

import com.ideatrack.backend.domain.CreditLedgerEntry;
import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.LineageEdge;
import com.ideatrack.backend.domain.Outcome;
import com.ideatrack.backend.domain.UserAccuracyProfile;

import java.util.List;

/**
 * Persisted layout: submissions, lineage edges, outcomes, credit ledger, profiles.
 */
public record StoreSnapshot(
        int version,
        List<IdeaSubmission> submissions,
        List<LineageEdge> lineageEdges,
        List<Outcome> outcomes,
        List<CreditLedgerEntry> creditLedger,
        List<UserAccuracyProfile> profiles
) {
    public static final int CURRENT_VERSION = 1;
}
