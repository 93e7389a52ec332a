package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.ProfileChange;
import com.ideatrack.backend.domain.SubmissionStatus;
import com.ideatrack.backend.error.SubmissionNotFoundException;
import com.ideatrack.backend.error.ValidationException;
import com.ideatrack.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Holds idea records. Text, owner, confidence and creation time never change; only the status moves
 * forward from {@code submitted}.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    static final String TRACKING_PREFIX = "IDEA-";
    // 0, O, 1, I 제외
    static final String TRACKING_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int TRACKING_LENGTH = 6;
    private static final int MAX_ID_ATTEMPTS = 10;

    private final InMemoryStore store;
    private final HistoryService history;
    private final ReputationService reputation;
    private final NotificationDispatcher notifications;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public SubmissionService(InMemoryStore store,
                             HistoryService history,
                             ReputationService reputation,
                             NotificationDispatcher notifications,
                             Clock clock) {
        this.store = store;
        this.history = history;
        this.reputation = reputation;
        this.notifications = notifications;
        this.clock = clock;
    }

    /**
     * Stores a new idea and returns its tracking id. Identical inputs still get a fresh id.
     */
    public IdeaSubmission create(String ownerId, String text, Double confidence, String classification) {
        if (ownerId == null || ownerId.isBlank()) throw new ValidationException("ownerId is required");
        if (text == null || text.isBlank()) throw new ValidationException("text is required");
        Scores.requireUnit("confidence", confidence);

        Created created = store.write(() -> {
            IdeaSubmission s = new IdeaSubmission(
                    mintTrackingId(),
                    ownerId.trim(),
                    text,
                    confidence,
                    classification,
                    Instant.now(clock),
                    SubmissionStatus.SUBMITTED
            );
            store.submissions.put(s.id(), s);
            history.append(s.ownerId(), HistoryService.SCOPE_SUBMISSION, s.id(), "CREATE",
                    Map.of("status", s.status().wire()));
            log.debug("Submitted {} for owner {}", s.id(), s.ownerId());
            return new Created(s, reputation.recompute(List.of(s.ownerId())));
        });
        notifications.profilesChanged(created.changes());
        return created.submission();
    }

    private record Created(IdeaSubmission submission, List<ProfileChange> changes) {}

    public IdeaSubmission get(String trackingId) {
        IdeaSubmission s = trackingId == null ? null : store.submissions.get(trackingId);
        if (s == null) throw new SubmissionNotFoundException(trackingId);
        return s;
    }

    /**
     * Moves a submission out of {@code submitted}. Later statuses are kept as they are.
     * Must run inside a store write.
     */
    boolean advanceStatus(String trackingId, SubmissionStatus next) {
        IdeaSubmission prev = get(trackingId);
        if (prev.status() != SubmissionStatus.SUBMITTED) {
            return false;
        }
        store.submissions.put(trackingId, prev.withStatus(next));
        history.append(prev.ownerId(), HistoryService.SCOPE_SUBMISSION, trackingId, next.name(),
                Map.of("from", prev.status().wire(), "to", next.wire()));
        return true;
    }

    private String mintTrackingId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            StringBuilder sb = new StringBuilder(TRACKING_PREFIX);
            for (int i = 0; i < TRACKING_LENGTH; i++) {
                sb.append(TRACKING_ALPHABET.charAt(random.nextInt(TRACKING_ALPHABET.length())));
            }
            String id = sb.toString();
            if (!store.submissions.containsKey(id)) {
                return id;
            }
        }
        throw new IllegalStateException("Could not mint a unique tracking id after " + MAX_ID_ATTEMPTS + " attempts");
    }
}
