package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.Outcome;
import com.ideatrack.backend.domain.TimeCapsuleEntry;
import com.ideatrack.backend.repo.InMemoryStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only, oldest-first view of one owner's ideas and how they turned out.
 */
@Service
public class TimeCapsuleService {

    private final InMemoryStore store;

    public TimeCapsuleService(InMemoryStore store) {
        this.store = store;
    }

    /**
     * Each iteration lists the owner's ideas created at or after {@code since} (all when null) and
     * builds every row on demand from the current state.
     */
    public Iterable<TimeCapsuleEntry> get(String ownerId, Instant since) {
        return () -> {
            List<String> ids = store.read(() -> store.submissions.values().stream()
                    .filter(s -> s.ownerId().equals(ownerId))
                    .filter(s -> since == null || !s.createdAt().isBefore(since))
                    .sorted(Comparator.comparing(IdeaSubmission::createdAt).thenComparing(IdeaSubmission::id))
                    .map(IdeaSubmission::id)
                    .collect(Collectors.toList()));
            Iterator<String> it = ids.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return it.hasNext();
                }

                @Override
                public TimeCapsuleEntry next() {
                    String id = it.next();
                    return store.read(() -> toEntry(id));
                }
            };
        };
    }

    private TimeCapsuleEntry toEntry(String id) {
        IdeaSubmission s = store.submissions.get(id);
        Outcome o = store.outcomes.get(id);
        return new TimeCapsuleEntry(
                s,
                o,
                o == null ? null : o.accuracyScore(),
                store.creditTotal(id),
                store.edgesByChild.get(id),
                store.childIds(id).size()
        );
    }
}
