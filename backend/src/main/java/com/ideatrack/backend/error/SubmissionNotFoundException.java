package com.ideatrack.backend.error;

public class SubmissionNotFoundException extends IdeaTrackException {

    private static final long serialVersionUID = 1L;

    private final String trackingId;

    public SubmissionNotFoundException(String trackingId) {
        super(404, "NOT_FOUND", "Submission not found: " + trackingId);
        this.trackingId = trackingId;
    }

    public String getTrackingId() {
        return trackingId;
    }
}
