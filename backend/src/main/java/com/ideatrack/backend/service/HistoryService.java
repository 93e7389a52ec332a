package com.ideatrack.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideatrack.backend.config.IdeaTrackProperties;
import com.ideatrack.backend.domain.HistoryEvent;
import com.ideatrack.backend.repo.InMemoryStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Newest-first audit trail of lifecycle changes, per owner. Keeps at most
 * {@code ideatrack.history.max-events} events across all owners; the oldest are dropped first.
 */
@Service
public class HistoryService {

    public static final String SCOPE_SUBMISSION = "SUBMISSION";
    public static final String SCOPE_LINEAGE = "LINEAGE";
    public static final String SCOPE_OUTCOME = "OUTCOME";
    public static final String SCOPE_CREDIT = "CREDIT";
    public static final String SCOPE_PROFILE = "PROFILE";

    private final InMemoryStore store;
    private final ObjectMapper om;
    private final Clock clock;
    private final int maxEvents;

    public HistoryService(InMemoryStore store, ObjectMapper om, Clock clock, IdeaTrackProperties props) {
        int cap = props.getHistory().getMaxEvents();
        if (cap < 1) {
            throw new IllegalArgumentException("ideatrack.history.max-events must be positive, got " + cap);
        }
        this.store = store;
        this.om = om;
        this.clock = clock;
        this.maxEvents = cap;
    }

    public HistoryEvent append(String ownerId, String scope, String entityId, String type, Object payload) {
        JsonNode node = payload == null ? null : om.valueToTree(payload);
        HistoryEvent ev = new HistoryEvent(
                UUID.randomUUID().toString(),
                ownerId,
                scope,
                entityId,
                type,
                node,
                Instant.now(clock)
        );
        store.addHistory(ev, maxEvents); // 최신이 앞
        return ev;
    }

    public List<HistoryEvent> query(String ownerId, String scope, String entityId, String type, int limit) {
        return store.history.stream()
                .filter(h -> h.ownerId().equals(ownerId))
                .filter(h -> scope == null || scope.isBlank() || h.scope().equalsIgnoreCase(scope))
                .filter(h -> entityId == null || entityId.isBlank() || h.entityId().equals(entityId))
                .filter(h -> type == null || type.isBlank() || h.type().equalsIgnoreCase(type))
                .limit(Math.max(1, Math.min(limit, 200)))
                .collect(Collectors.toList());
    }
}
