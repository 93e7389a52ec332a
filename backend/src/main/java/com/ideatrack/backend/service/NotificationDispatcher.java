package com.ideatrack.backend.service;

import com.ideatrack.backend.config.IdeaTrackProperties;
import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.Outcome;
import com.ideatrack.backend.domain.ProfileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fire-and-forget delivery: a failing publisher is logged and never fails the write that triggered it.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationPublisher publisher;
    private final double profileChangeThreshold;

    public NotificationDispatcher(NotificationPublisher publisher, IdeaTrackProperties props) {
        this.publisher = publisher;
        this.profileChangeThreshold = props.getNotification().getProfileChangeThreshold();
    }

    public void outcomeRecorded(IdeaSubmission submission, Outcome outcome) {
        try {
            publisher.outcomeRecorded(submission, outcome);
        } catch (RuntimeException e) {
            log.warn("Outcome notification for {} failed: {}", submission.id(), e.toString());
        }
    }

    public void profilesChanged(List<ProfileChange> changes) {
        for (ProfileChange change : changes) {
            if (!isMaterial(change)) continue;
            try {
                publisher.profileChanged(change.before(), change.after());
            } catch (RuntimeException e) {
                log.warn("Profile notification for {} failed: {}", change.after().ownerId(), e.toString());
            }
        }
    }

    boolean isMaterial(ProfileChange change) {
        // 최초 프로필은 항상 알림
        if (change.before() == null) {
            return true;
        }
        double delta = Math.abs(change.after().reputationScore() - change.before().reputationScore());
        return delta >= profileChangeThreshold;
    }
}
