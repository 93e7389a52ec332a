package com.ideatrack.backend.error;

/**
 * Base of all core failures. Carries the HTTP status and a stable error code for the API layer.
 */
public class IdeaTrackException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String code;

    public IdeaTrackException(int status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
