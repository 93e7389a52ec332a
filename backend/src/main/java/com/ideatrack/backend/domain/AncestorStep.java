package com.ideatrack.backend.domain;

/**
 * One hop of an ancestor walk: {@code edge} links {@code ancestor} to the previous node.
 */
public record AncestorStep(
        int distance,
        LineageEdge edge,
        IdeaSubmission ancestor
) {}
