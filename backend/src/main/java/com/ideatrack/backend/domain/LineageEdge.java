package com.ideatrack.backend.domain;

import java.time.Instant;

public record LineageEdge(
        String id,
        String parentId,
        String childId,
        RefinementType refinementType,
        double depthIncrease,   // 0.0 ~ 1.0
        String question,        // question that led to the refinement (optional)
        Instant createdAt
) {}
