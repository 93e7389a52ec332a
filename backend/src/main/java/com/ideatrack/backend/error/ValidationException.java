package com.ideatrack.backend.error;

/**
 * Input out of range or missing.
 */
public class ValidationException extends IdeaTrackException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(400, "VALIDATION_ERROR", message);
    }
}
