package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.*;
import com.ideatrack.backend.error.ValidationException;
import com.ideatrack.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Records validation results. Each write scores the outcome, replaces the previous one, re-credits
 * the ancestors and recomputes the affected profiles as one unit.
 */
@Service
public class OutcomeService {

    private static final Logger log = LoggerFactory.getLogger(OutcomeService.class);

    private static final double SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final InMemoryStore store;
    private final SubmissionService submissions;
    private final AccuracyCalculator calculator;
    private final BackpropagationService backprop;
    private final ReputationService reputation;
    private final NotificationDispatcher notifications;
    private final HistoryService history;
    private final Clock clock;

    public OutcomeService(InMemoryStore store,
                          SubmissionService submissions,
                          AccuracyCalculator calculator,
                          BackpropagationService backprop,
                          ReputationService reputation,
                          NotificationDispatcher notifications,
                          HistoryService history,
                          Clock clock) {
        this.store = store;
        this.submissions = submissions;
        this.calculator = calculator;
        this.backprop = backprop;
        this.reputation = reputation;
        this.notifications = notifications;
        this.history = history;
        this.clock = clock;
    }

    public record OutcomeCommand(
            String trackingId,
            Double result,
            String validationSource,
            Instant validatedAt,     // null = now
            String validationUrl,
            String validationNotes
    ) {}

    private record Committed(IdeaSubmission submission, OutcomeRecording recording, List<ProfileChange> changes) {}

    public OutcomeRecording recordOutcome(String trackingId, double result, String source, Instant validatedAt) {
        return recordOutcome(new OutcomeCommand(trackingId, result, source, validatedAt, null, null));
    }

    /**
     * @throws com.ideatrack.backend.error.SubmissionNotFoundException unknown tracking id
     * @throws ValidationException result outside [0,1] or missing source
     */
    public OutcomeRecording recordOutcome(OutcomeCommand cmd) {
        if (cmd.result() == null) throw new ValidationException("result is required");
        Scores.requireUnit("result", cmd.result());
        if (cmd.validationSource() == null || cmd.validationSource().isBlank()) {
            throw new ValidationException("validationSource is required");
        }

        Committed committed = store.write(() -> {
            IdeaSubmission s = submissions.get(cmd.trackingId());
            Instant at = cmd.validatedAt() != null ? cmd.validatedAt() : Instant.now(clock);
            Duration elapsed = Duration.between(s.createdAt(), at);
            double days = (elapsed.getSeconds() + elapsed.getNano() / 1e9) / SECONDS_PER_DAY;

            AccuracyScore score = calculator.score(cmd.result(), s.confidence(), days);
            List<DataIntegrityWarning> warnings = new ArrayList<>();
            if (score.elapsedClamped()) {
                DataIntegrityWarning w = new DataIntegrityWarning(
                        s.id(),
                        DataIntegrityWarning.NEGATIVE_ELAPSED,
                        "validatedAt " + at + " precedes createdAt " + s.createdAt() + "; elapsed days clamped to 0",
                        Instant.now(clock));
                log.warn("Data integrity: {} {}", s.id(), w.message());
                warnings.add(w);
            }

            Outcome outcome = new Outcome(
                    "OUTCOME-" + s.id(),
                    s.id(),
                    cmd.result(),
                    cmd.validationSource().trim(),
                    cmd.validationUrl(),
                    cmd.validationNotes(),
                    at,
                    s.confidence(),
                    score.daysElapsed(),
                    score.earlyBirdMultiplier(),
                    score.calibrationPenalty(),
                    score.accuracyScore()
            );

            // 조상 탐색 실패 시 아무것도 저장하지 않음
            List<CreditLedgerEntry> credits = backprop.plan(s.id(), outcome.accuracyScore());

            Outcome previous = store.outcomes.put(s.id(), outcome);
            submissions.advanceStatus(s.id(), SubmissionStatus.VALIDATED);
            history.append(s.ownerId(), HistoryService.SCOPE_OUTCOME, s.id(),
                    previous == null ? "RECORDED" : "REPLACED", outcome);
            warnings.forEach(w -> history.append(s.ownerId(), HistoryService.SCOPE_OUTCOME, s.id(), "WARNING", w));

            Set<String> owners = new LinkedHashSet<>();
            owners.add(s.ownerId());
            owners.addAll(backprop.apply(s.id(), credits));

            log.info("Outcome {} for {}: result={} days={} accuracy={} credited {} ancestor(s)",
                    previous == null ? "recorded" : "replaced", s.id(), cmd.result(),
                    String.format("%.1f", score.daysElapsed()), String.format("%.4f", score.accuracyScore()),
                    credits.size());
            return new Committed(
                    store.submissions.get(s.id()),
                    new OutcomeRecording(outcome, List.copyOf(credits), List.copyOf(warnings)),
                    reputation.recompute(owners));
        });

        notifications.outcomeRecorded(committed.submission(), committed.recording().outcome());
        notifications.profilesChanged(committed.changes());
        return committed.recording();
    }

    public Optional<Outcome> getOutcome(String trackingId) {
        submissions.get(trackingId);
        return Optional.ofNullable(store.outcomes.get(trackingId));
    }
}
