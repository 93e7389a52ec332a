package com.ideatrack.backend.domain;

import java.util.List;

public record LineageView(
        IdeaSubmission submission,
        LineageEdge parentEdge,
        List<AncestorStep> ancestors,
        List<LineageEdge> children
) {}
