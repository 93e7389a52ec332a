package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.Outcome;
import com.ideatrack.backend.domain.UserAccuracyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default publisher used until a delivery channel is wired in; logs the events.
 */
@Component
public class LoggingNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationPublisher.class);

    @Override
    public void outcomeRecorded(IdeaSubmission submission, Outcome outcome) {
        log.info("notify:outcome owner={} idea={} result={} accuracy={}",
                submission.ownerId(), submission.id(), outcome.result(),
                String.format("%.4f", outcome.accuracyScore()));
    }

    @Override
    public void profileChanged(UserAccuracyProfile before, UserAccuracyProfile after) {
        log.info("notify:profile owner={} reputation {} -> {}",
                after.ownerId(),
                before == null ? "-" : String.format("%.4f", before.reputationScore()),
                String.format("%.4f", after.reputationScore()));
    }
}
