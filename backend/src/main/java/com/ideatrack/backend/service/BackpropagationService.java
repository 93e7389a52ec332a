package com.ideatrack.backend.service;

import com.ideatrack.backend.config.IdeaTrackProperties;
import com.ideatrack.backend.domain.AncestorStep;
import com.ideatrack.backend.domain.CreditLedgerEntry;
import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.Outcome;
import com.ideatrack.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Distributes a validated submission's accuracy score to its ancestors, decayed by distance:
 * the ancestor at distance {@code d} receives {@code score * factor^d}. A negative score credits
 * nothing; ancestors never lose standing because a descendant was wrong.
 * <p>
 * Work is split into {@code plan*} (reads only, may throw) and {@code apply} (replaces the source's
 * ledger entries in one step), so a failed walk leaves the ledger untouched and re-running for the
 * same source never adds up.
 */
@Service
public class BackpropagationService {

    private static final Logger log = LoggerFactory.getLogger(BackpropagationService.class);

    private final InMemoryStore store;
    private final HistoryService history;
    private final Clock clock;
    private final double depthDecayFactor;
    private final int maxAncestorDepth;

    public BackpropagationService(InMemoryStore store, HistoryService history, Clock clock, IdeaTrackProperties props) {
        double factor = props.getBackprop().getDepthDecayFactor();
        if (!(factor > 0.0 && factor <= 1.0)) {
            throw new IllegalArgumentException("ideatrack.backprop.depth-decay-factor must be in (0,1], got " + factor);
        }
        this.store = store;
        this.history = history;
        this.clock = clock;
        this.depthDecayFactor = factor;
        this.maxAncestorDepth = props.getLineage().getMaxAncestorDepth();
    }

    /**
     * Ledger entries {@code sourceId} would grant with the given score, nearest ancestor first.
     */
    public List<CreditLedgerEntry> plan(String sourceId, double accuracyScore) {
        Instant now = Instant.now(clock);
        double creditable = Math.max(0.0, accuracyScore);
        List<CreditLedgerEntry> out = new ArrayList<>();
        for (AncestorStep step : new AncestorPath(store, sourceId, maxAncestorDepth)) {
            double fraction = Math.pow(depthDecayFactor, step.distance());
            out.add(new CreditLedgerEntry(
                    step.edge().parentId(),
                    sourceId,
                    step.distance(),
                    fraction,
                    creditable * fraction,
                    now
            ));
        }
        return out;
    }

    /**
     * Plans every validated submission in the subtree rooted at {@code rootId} (root included).
     */
    public Map<String, List<CreditLedgerEntry>> planSubtree(String rootId) {
        Map<String, List<CreditLedgerEntry>> plans = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(rootId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) continue;
            Outcome outcome = store.outcomes.get(id);
            if (outcome != null) {
                plans.put(id, plan(id, outcome.accuracyScore()));
            }
            queue.addAll(store.childIds(id));
        }
        return plans;
    }

    /**
     * Replaces everything previously credited by {@code sourceId} with {@code entries}.
     * Must run inside a store write.
     *
     * @return owners whose credited totals may have changed (old and new recipients)
     */
    public Set<String> apply(String sourceId, List<CreditLedgerEntry> entries) {
        List<CreditLedgerEntry> previous = entries.isEmpty()
                ? store.ledgerBySource.remove(sourceId)
                : store.ledgerBySource.put(sourceId, List.copyOf(entries));

        Set<String> owners = new LinkedHashSet<>();
        if (previous != null) {
            previous.forEach(e -> ownerOf(e.submissionId()).ifPresent(owners::add));
        }
        for (CreditLedgerEntry e : entries) {
            ownerOf(e.submissionId()).ifPresent(owner -> {
                owners.add(owner);
                history.append(owner, HistoryService.SCOPE_CREDIT, e.submissionId(),
                        previous == null ? "CREDITED" : "RECREDITED", e);
            });
        }
        log.debug("Backprop from {}: retracted {} entr(ies), applied {}",
                sourceId, previous == null ? 0 : previous.size(), entries.size());
        return owners;
    }

    /**
     * Drops all ledger entries and applies the given plans. Must run inside a store write.
     */
    public Set<String> replaceAll(Map<String, List<CreditLedgerEntry>> plans) {
        Set<String> owners = new LinkedHashSet<>();
        store.ledgerBySource.values().forEach(list ->
                list.forEach(e -> ownerOf(e.submissionId()).ifPresent(owners::add)));
        store.ledgerBySource.clear();
        plans.forEach((sourceId, entries) -> {
            if (!entries.isEmpty()) {
                store.ledgerBySource.put(sourceId, List.copyOf(entries));
                entries.forEach(e -> ownerOf(e.submissionId()).ifPresent(owners::add));
            }
        });
        return owners;
    }

    private Optional<String> ownerOf(String submissionId) {
        return Optional.ofNullable(store.submissions.get(submissionId)).map(IdeaSubmission::ownerId);
    }
}
