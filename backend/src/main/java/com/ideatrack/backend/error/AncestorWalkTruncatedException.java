package com.ideatrack.backend.error;

/**
 * The ancestor walk hit the configured depth bound before reaching a root.
 */
public class AncestorWalkTruncatedException extends IdeaTrackException {

    private static final long serialVersionUID = 1L;

    private final String startId;
    private final int limit;

    public AncestorWalkTruncatedException(String startId, int limit) {
        super(422, "ANCESTOR_WALK_TRUNCATED",
                "Ancestor walk from " + startId + " exceeded " + limit + " steps");
        this.startId = startId;
        this.limit = limit;
    }

    public String getStartId() {
        return startId;
    }

    public int getLimit() {
        return limit;
    }
}
