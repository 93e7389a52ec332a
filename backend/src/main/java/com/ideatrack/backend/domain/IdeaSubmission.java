package com.ideatrack.backend.domain;

import java.time.Instant;

/**
 * A single tracked idea. Everything except {@code status} is fixed at creation.
 *
 * @param id             tracking id, e.g. {@code IDEA-A3B9F2}
 * @param confidence     owner's declared confidence in [0,1], or null when undeclared
 * @param classification opaque tag handed over by the intake surface
 */
public record IdeaSubmission(
        String id,
        String ownerId,
        String text,
        Double confidence,
        String classification,
        Instant createdAt,
        SubmissionStatus status
) {

    public IdeaSubmission withStatus(SubmissionStatus next) {
        return new IdeaSubmission(id, ownerId, text, confidence, classification, createdAt, next);
    }
}
