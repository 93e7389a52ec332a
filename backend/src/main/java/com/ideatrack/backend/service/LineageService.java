package com.ideatrack.backend.service;

import com.ideatrack.backend.config.IdeaTrackProperties;
import com.ideatrack.backend.domain.*;
import com.ideatrack.backend.error.LineageCycleException;
import com.ideatrack.backend.error.MultipleParentException;
import com.ideatrack.backend.error.ValidationException;
import com.ideatrack.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Single-parent refinement tree over submissions.
 */
@Service
public class LineageService {

    private static final Logger log = LoggerFactory.getLogger(LineageService.class);

    public static final double DEFAULT_DEPTH_INCREASE = 0.1;

    private final InMemoryStore store;
    private final SubmissionService submissions;
    private final BackpropagationService backprop;
    private final ReputationService reputation;
    private final NotificationDispatcher notifications;
    private final HistoryService history;
    private final Clock clock;
    private final int maxAncestorDepth;

    public LineageService(InMemoryStore store,
                          SubmissionService submissions,
                          BackpropagationService backprop,
                          ReputationService reputation,
                          NotificationDispatcher notifications,
                          HistoryService history,
                          Clock clock,
                          IdeaTrackProperties props) {
        this.store = store;
        this.submissions = submissions;
        this.backprop = backprop;
        this.reputation = reputation;
        this.notifications = notifications;
        this.history = history;
        this.clock = clock;
        this.maxAncestorDepth = props.getLineage().getMaxAncestorDepth();
    }

    private record LinkResult(LineageEdge edge, List<ProfileChange> changes) {}

    /**
     * Links {@code childId} as a refinement of {@code parentId}.
     * <p>
     * Repeating an identical link returns the existing edge. Validated submissions under the child
     * gain ancestors, so their credit is re-applied; nothing is stored if that planning fails.
     *
     * @throws com.ideatrack.backend.error.SubmissionNotFoundException either id is unknown
     * @throws LineageCycleException     the child is the parent or one of its ancestors
     * @throws MultipleParentException   the child already has a different parent edge
     * @throws ValidationException       the same link already exists with other attributes
     */
    public LineageEdge link(String parentId, String childId, RefinementType refinementType,
                            Double depthIncrease, String question) {
        if (refinementType == null) throw new ValidationException("refinementType is required");
        double depth = depthIncrease == null ? DEFAULT_DEPTH_INCREASE : depthIncrease;
        Scores.requireUnit("depthIncrease", depth);

        LinkResult result = store.write(() -> {
            IdeaSubmission parent = submissions.get(parentId);
            IdeaSubmission child = submissions.get(childId);

            LineageEdge existing = store.edgesByChild.get(child.id());
            if (existing != null) {
                if (sameLink(existing, parent.id(), refinementType, depth, question)) {
                    return new LinkResult(existing, List.of());
                }
                if (existing.parentId().equals(parent.id())) {
                    throw new ValidationException(child.id() + " is already linked under " + parent.id()
                            + " with different attributes (" + existing.id() + ")");
                }
                throw new MultipleParentException(child.id(), existing.parentId());
            }
            if (parent.id().equals(child.id())) {
                throw new LineageCycleException(parent.id(), child.id());
            }
            for (AncestorStep step : ancestorsOf(parent.id())) {
                if (step.edge().parentId().equals(child.id())) {
                    throw new LineageCycleException(parent.id(), child.id());
                }
            }

            LineageEdge edge = new LineageEdge(
                    "EDGE-" + child.id(),
                    parent.id(),
                    child.id(),
                    refinementType,
                    depth,
                    question,
                    Instant.now(clock)
            );
            attach(edge);

            Map<String, List<CreditLedgerEntry>> plans;
            try {
                plans = backprop.planSubtree(child.id());
            } catch (RuntimeException e) {
                detach(edge);
                throw e;
            }

            submissions.advanceStatus(parent.id(), SubmissionStatus.SUPERSEDED);
            history.append(child.ownerId(), HistoryService.SCOPE_LINEAGE, edge.id(), "LINK", edge);
            if (!parent.ownerId().equals(child.ownerId())) {
                history.append(parent.ownerId(), HistoryService.SCOPE_LINEAGE, edge.id(), "LINK", edge);
            }

            Set<String> owners = new LinkedHashSet<>();
            plans.forEach((sourceId, entries) -> owners.addAll(backprop.apply(sourceId, entries)));
            log.info("Linked {} -> {} ({}), re-credited {} validated descendant(s)",
                    parent.id(), child.id(), refinementType.wire(), plans.size());
            return new LinkResult(edge, reputation.recompute(owners));
        });

        notifications.profilesChanged(result.changes());
        return result.edge();
    }

    /**
     * Ancestors of {@code trackingId}, nearest first. Empty for a root.
     */
    public AncestorPath ancestors(String trackingId) {
        submissions.get(trackingId);
        return ancestorsOf(trackingId);
    }

    AncestorPath ancestorsOf(String trackingId) {
        return new AncestorPath(store, trackingId, maxAncestorDepth);
    }

    /**
     * Direct children only, in link order.
     */
    public List<IdeaSubmission> descendants(String trackingId) {
        submissions.get(trackingId);
        return store.childIds(trackingId).stream()
                .map(store.submissions::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    public LineageView lineage(String trackingId) {
        IdeaSubmission s = submissions.get(trackingId);
        return store.read(() -> new LineageView(
                s,
                store.edgesByChild.get(trackingId),
                ancestorsOf(trackingId).toList(),
                store.childIds(trackingId).stream()
                        .map(store.edgesByChild::get)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList())
        ));
    }

    // ---------------- helpers ----------------

    private void attach(LineageEdge edge) {
        store.edgesByChild.put(edge.childId(), edge);
        store.childrenByParent.computeIfAbsent(edge.parentId(), k -> new CopyOnWriteArrayList<>()).add(edge.childId());
    }

    private void detach(LineageEdge edge) {
        store.edgesByChild.remove(edge.childId(), edge);
        List<String> siblings = store.childrenByParent.get(edge.parentId());
        if (siblings != null) {
            siblings.remove(edge.childId());
            if (siblings.isEmpty()) store.childrenByParent.remove(edge.parentId(), siblings);
        }
    }

    private boolean sameLink(LineageEdge e, String parentId, RefinementType type, double depth, String question) {
        return e.parentId().equals(parentId)
                && e.refinementType() == type
                && Double.compare(e.depthIncrease(), depth) == 0
                && Objects.equals(e.question(), question);
    }
}
