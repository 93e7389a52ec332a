package com.ideatrack.backend.error;

public class LineageCycleException extends IdeaTrackException {

    private static final long serialVersionUID = 1L;

    public LineageCycleException(String parentId, String childId) {
        super(409, "LINEAGE_CYCLE",
                "Linking " + parentId + " -> " + childId + " would create a cycle");
    }
}
