package com.ideatrack.backend.repo;

import com.ideatrack.backend.domain.*;
import com.ideatrack.backend.service.storage.StoreSnapshot;
import com.ideatrack.backend.service.storage.StoreSnapshotFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-wide state. All mutations go through {@link #write(Supplier)}, which serializes writers and
 * commits the snapshot file once the outermost write returns. If the write or the snapshot commit
 * fails, the maps are put back to the state before the write. Readers that need a consistent view
 * (ledger totals, profiles) use {@link #read(Supplier)}.
 */
@Component
public class InMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStore.class);

    public final ConcurrentHashMap<String, IdeaSubmission> submissions = new ConcurrentHashMap<>();

    // childId -> edge (single parent)
    public final ConcurrentHashMap<String, LineageEdge> edgesByChild = new ConcurrentHashMap<>();
    // parentId -> childIds in link order
    public final ConcurrentHashMap<String, List<String>> childrenByParent = new ConcurrentHashMap<>();

    // submissionId -> live outcome
    public final ConcurrentHashMap<String, Outcome> outcomes = new ConcurrentHashMap<>();

    // sourceDescendantId -> immutable list of entries from its last backprop run
    public final ConcurrentHashMap<String, List<CreditLedgerEntry>> ledgerBySource = new ConcurrentHashMap<>();

    public final ConcurrentHashMap<String, UserAccuracyProfile> profiles = new ConcurrentHashMap<>();
    // newest first, trimmed from the tail by addHistory
    public final ConcurrentLinkedDeque<HistoryEvent> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger historySize = new AtomicInteger();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final StoreSnapshotFile snapshotFile;

    /** Memory-only store. */
    public InMemoryStore() {
        this.snapshotFile = null;
    }

    @Autowired
    public InMemoryStore(StoreSnapshotFile snapshotFile) {
        this.snapshotFile = snapshotFile;
        snapshotFile.load().ifPresent(this::restore);
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            if (lock.getWriteHoldCount() > 1) {
                return action.get();
            }
            StoreSnapshot before = snapshot();
            Map<String, List<String>> childOrder = new HashMap<>();
            childrenByParent.forEach((k, v) -> childOrder.put(k, List.copyOf(v)));
            HistoryEvent historyHead = history.peekFirst();
            try {
                T result = action.get();
                if (snapshotFile != null) {
                    snapshotFile.write(snapshot());
                }
                return result;
            } catch (RuntimeException | Error e) {
                rollback(before, childOrder, historyHead);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds {@code event} as the newest entry and drops the oldest ones beyond {@code hardCap}.
     */
    public void addHistory(HistoryEvent event, int hardCap) {
        history.addFirst(event);
        historySize.incrementAndGet();
        while (historySize.get() > hardCap && history.pollLast() != null) {
            historySize.decrementAndGet();
        }
    }

    public List<CreditLedgerEntry> creditsTo(String submissionId) {
        return ledgerBySource.values().stream()
                .flatMap(List::stream)
                .filter(e -> e.submissionId().equals(submissionId))
                .collect(Collectors.toList());
    }

    public double creditTotal(String submissionId) {
        return ledgerBySource.values().stream()
                .flatMap(List::stream)
                .filter(e -> e.submissionId().equals(submissionId))
                .mapToDouble(CreditLedgerEntry::creditedAmount)
                .sum();
    }

    public List<String> childIds(String parentId) {
        return childrenByParent.getOrDefault(parentId, List.of());
    }

    public StoreSnapshot snapshot() {
        return read(() -> new StoreSnapshot(
                StoreSnapshot.CURRENT_VERSION,
                new ArrayList<>(submissions.values()),
                new ArrayList<>(edgesByChild.values()),
                new ArrayList<>(outcomes.values()),
                ledgerBySource.values().stream().flatMap(List::stream).collect(Collectors.toList()),
                new ArrayList<>(profiles.values())
        ));
    }

    private void rollback(StoreSnapshot before, Map<String, List<String>> childOrder, HistoryEvent historyHead) {
        submissions.clear();
        edgesByChild.clear();
        childrenByParent.clear();
        outcomes.clear();
        ledgerBySource.clear();
        profiles.clear();
        restore(before);
        childrenByParent.clear();
        childOrder.forEach((k, v) -> childrenByParent.put(k, new CopyOnWriteArrayList<>(v)));
        // events appended by the failed write sit in front of the old head
        while (!history.isEmpty() && history.peekFirst() != historyHead) {
            history.pollFirst();
            historySize.decrementAndGet();
        }
        log.warn("Write rolled back; store restored to {} submissions", submissions.size());
    }

    private void restore(StoreSnapshot s) {
        nz(s.submissions()).forEach(sub -> submissions.put(sub.id(), sub));
        nz(s.lineageEdges()).stream()
                .sorted(Comparator.comparing(LineageEdge::createdAt).thenComparing(LineageEdge::id))
                .forEach(e -> {
                    edgesByChild.put(e.childId(), e);
                    childrenByParent.computeIfAbsent(e.parentId(), k -> new CopyOnWriteArrayList<>()).add(e.childId());
                });
        nz(s.outcomes()).forEach(o -> outcomes.put(o.submissionId(), o));
        Map<String, List<CreditLedgerEntry>> bySource = nz(s.creditLedger()).stream()
                .collect(Collectors.groupingBy(CreditLedgerEntry::sourceDescendantId));
        bySource.forEach((k, v) -> ledgerBySource.put(k, List.copyOf(v)));
        nz(s.profiles()).forEach(p -> profiles.put(p.ownerId(), p));
    }

    private static <T> List<T> nz(List<T> list) {
        return list == null ? List.of() : list;
    }
}
