package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.*;
import com.ideatrack.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Derives per-owner profiles from submissions, outcomes and the credit ledger. A profile holds no
 * state of its own: {@link #derive(String)} rebuilds it from scratch every time.
 * <pre>
 * accuracyRate     = count(result &gt;= 0.5) / validated
 * calibrationScore = 1 - mean(|confidence - result|)   over validated ideas with declared confidence
 * reputationScore  = 0.4 * accuracyRate + 0.3 * calibrationScore + 0.3 * clamp(meanDaysEarly / 365, 0, 1)
 * </pre>
 */
@Service
public class ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    static final double CORRECT_THRESHOLD = 0.5;
    static final double ACCURACY_WEIGHT = 0.4;
    static final double CALIBRATION_WEIGHT = 0.3;
    static final double EARLINESS_WEIGHT = 0.3;

    private final InMemoryStore store;
    private final BackpropagationService backprop;
    private final NotificationDispatcher notifications;
    private final HistoryService history;
    private final Clock clock;

    public ReputationService(InMemoryStore store,
                             BackpropagationService backprop,
                             NotificationDispatcher notifications,
                             HistoryService history,
                             Clock clock) {
        this.store = store;
        this.backprop = backprop;
        this.notifications = notifications;
        this.history = history;
        this.clock = clock;
    }

    /**
     * Stored profile, or a freshly derived one when the owner has never been recomputed.
     */
    public UserAccuracyProfile getProfile(String ownerId) {
        return store.read(() -> {
            UserAccuracyProfile stored = store.profiles.get(ownerId);
            return stored != null ? stored : derive(ownerId);
        });
    }

    /**
     * Recomputes and stores one owner's profile.
     */
    public UserAccuracyProfile recompute(String ownerId) {
        List<ProfileChange> changes = store.write(() -> recompute(List.of(ownerId)));
        notifications.profilesChanged(changes);
        return changes.get(0).after();
    }

    /**
     * Recomputes the given owners. Must run inside a store write; callers publish the returned
     * changes once the write is done.
     */
    List<ProfileChange> recompute(Collection<String> ownerIds) {
        List<ProfileChange> changes = new ArrayList<>();
        for (String ownerId : new LinkedHashSet<>(ownerIds)) {
            UserAccuracyProfile after = derive(ownerId);
            UserAccuracyProfile before = store.profiles.put(ownerId, after);
            if (before == null || !sameScores(before, after)) {
                history.append(ownerId, HistoryService.SCOPE_PROFILE, ownerId, "RECOMPUTED", after);
            }
            changes.add(new ProfileChange(before, after));
        }
        return changes;
    }

    /**
     * Recovery path: re-plans the whole ledger from the live outcomes and recomputes every owner.
     * Converges to the same state as the incremental updates.
     */
    public List<UserAccuracyProfile> rebuildAll() {
        List<ProfileChange> changes = store.write(() -> {
            Map<String, List<CreditLedgerEntry>> plans = new LinkedHashMap<>();
            store.outcomes.values().stream()
                    .sorted(Comparator.comparing(Outcome::submissionId))
                    .forEach(o -> plans.put(o.submissionId(), backprop.plan(o.submissionId(), o.accuracyScore())));
            backprop.replaceAll(plans);

            Set<String> owners = store.submissions.values().stream()
                    .map(IdeaSubmission::ownerId)
                    .collect(Collectors.toCollection(TreeSet::new));
            owners.addAll(store.profiles.keySet());
            log.info("Rebuilt ledger from {} outcome(s) for {} owner(s)", plans.size(), owners.size());
            return recompute(owners);
        });
        notifications.profilesChanged(changes);
        return changes.stream().map(ProfileChange::after).collect(Collectors.toList());
    }

    /**
     * Computes a profile from the current history without storing it.
     */
    public UserAccuracyProfile derive(String ownerId) {
        List<IdeaSubmission> owned = store.submissions.values().stream()
                .filter(s -> s.ownerId().equals(ownerId))
                .collect(Collectors.toList());
        Instant now = Instant.now(clock);
        if (owned.isEmpty()) {
            return UserAccuracyProfile.empty(ownerId, now);
        }

        List<Outcome> validated = owned.stream()
                .map(s -> store.outcomes.get(s.id()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        int n = validated.size();

        double accuracyRate = n == 0 ? 0.0
                : validated.stream().filter(o -> o.result() >= CORRECT_THRESHOLD).count() / (double) n;

        List<Outcome> declared = validated.stream()
                .filter(o -> o.confidenceAtSubmission() != null)
                .collect(Collectors.toList());
        double calibrationScore;
        if (n == 0) {
            calibrationScore = 0.0;
        } else if (declared.isEmpty()) {
            calibrationScore = 1.0; // 불확실성 선언은 감점 없음
        } else {
            calibrationScore = 1.0 - declared.stream()
                    .mapToDouble(o -> Math.abs(o.confidenceAtSubmission() - o.result()))
                    .average()
                    .orElse(0.0);
        }

        double meanDaysEarly = validated.stream().mapToDouble(Outcome::daysElapsed).average().orElse(0.0);
        double daysEarlyNormalized = Math.max(0.0, Math.min(1.0, meanDaysEarly / AccuracyCalculator.DAYS_PER_YEAR));
        double reputationScore = ACCURACY_WEIGHT * accuracyRate
                + CALIBRATION_WEIGHT * calibrationScore
                + EARLINESS_WEIGHT * daysEarlyNormalized;

        double directScoreTotal = validated.stream().mapToDouble(Outcome::accuracyScore).sum();
        double inheritedCreditTotal = owned.stream().mapToDouble(s -> store.creditTotal(s.id())).sum();

        Instant lastSubmissionAt = owned.stream().map(IdeaSubmission::createdAt).max(Comparator.naturalOrder()).orElse(null);
        Instant lastValidationAt = validated.stream().map(Outcome::validatedAt).max(Comparator.naturalOrder()).orElse(null);

        return new UserAccuracyProfile(
                ownerId,
                owned.size(),
                n,
                accuracyRate,
                calibrationScore,
                reputationScore,
                meanDaysEarly,
                directScoreTotal,
                inheritedCreditTotal,
                lastSubmissionAt,
                lastValidationAt,
                now
        );
    }

    private boolean sameScores(UserAccuracyProfile a, UserAccuracyProfile b) {
        return a.totalSubmissions() == b.totalSubmissions()
                && a.totalValidations() == b.totalValidations()
                && Double.compare(a.reputationScore(), b.reputationScore()) == 0
                && Double.compare(a.directScoreTotal(), b.directScoreTotal()) == 0
                && Double.compare(a.inheritedCreditTotal(), b.inheritedCreditTotal()) == 0;
    }
}
