package com.ideatrack.backend.error;

public class MultipleParentException extends IdeaTrackException {

    private static final long serialVersionUID = 1L;

    public MultipleParentException(String childId, String existingParentId) {
        super(409, "MULTIPLE_PARENT",
                childId + " already refines " + existingParentId);
    }
}
