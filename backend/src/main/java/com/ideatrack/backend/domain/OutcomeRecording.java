package com.ideatrack.backend.domain;

import java.util.List;

public record OutcomeRecording(
        Outcome outcome,
        List<CreditLedgerEntry> credits,
        List<DataIntegrityWarning> warnings
) {}
