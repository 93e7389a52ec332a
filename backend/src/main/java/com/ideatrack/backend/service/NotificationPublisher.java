package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.Outcome;
import com.ideatrack.backend.domain.UserAccuracyProfile;

/**
 * One-way hand-off to the notification layer. Calls happen after the write has committed.
 */
public interface NotificationPublisher {

    void outcomeRecorded(IdeaSubmission submission, Outcome outcome);

    void profileChanged(UserAccuracyProfile before, UserAccuracyProfile after);
}
