package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.AncestorStep;
import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.LineageEdge;
import com.ideatrack.backend.error.AncestorWalkTruncatedException;
import com.ideatrack.backend.repo.InMemoryStore;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy walk from a submission up to its root, one edge per step. Every {@link #iterator()} starts
 * over from the beginning and reads the graph as it is at that moment.
 * <p>
 * A walk longer than {@code limit} steps throws {@link AncestorWalkTruncatedException} instead of
 * continuing.
 */
public final class AncestorPath implements Iterable<AncestorStep> {

    private final InMemoryStore store;
    private final String startId;
    private final int limit;

    public AncestorPath(InMemoryStore store, String startId, int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive");
        this.store = store;
        this.startId = startId;
        this.limit = limit;
    }

    @Override
    public Iterator<AncestorStep> iterator() {
        return new Walker();
    }

    public List<AncestorStep> toList() {
        List<AncestorStep> out = new ArrayList<>();
        for (AncestorStep step : this) {
            out.add(step);
        }
        return out;
    }

    private final class Walker implements Iterator<AncestorStep> {
        private String current = startId;
        private int distance = 0;
        private AncestorStep pending;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (pending == null && !done) {
                pending = step();
                done = pending == null;
            }
            return pending != null;
        }

        @Override
        public AncestorStep next() {
            if (!hasNext()) throw new NoSuchElementException();
            AncestorStep out = pending;
            pending = null;
            return out;
        }

        private AncestorStep step() {
            LineageEdge edge = store.edgesByChild.get(current);
            if (edge == null) return null;
            if (distance >= limit) {
                throw new AncestorWalkTruncatedException(startId, limit);
            }
            distance++;
            current = edge.parentId();
            IdeaSubmission ancestor = store.submissions.get(edge.parentId());
            return new AncestorStep(distance, edge, ancestor);
        }
    }
}
