package com.ideatrack.backend.domain;

/**
 * One row of an owner's time capsule.
 */
public record TimeCapsuleEntry(
        IdeaSubmission submission,
        Outcome outcome,            // null until validated
        Double accuracyScore,       // null until validated
        double inheritedCredit,
        LineageEdge parentLink,     // null for roots
        int childCount
) {}
