package com.ideatrack.backend.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record HistoryEvent(
        String id,
        String ownerId,
        String scope,    // "SUBMISSION" | "LINEAGE" | "OUTCOME" | "CREDIT" | "PROFILE"
        String entityId,
        String type,     // "CREATE" | "SUPERSEDED" | "LINK" | "RECORDED" | "CREDITED" | "RECOMPUTED" ...
        JsonNode payload,
        Instant createdAt
) {}
