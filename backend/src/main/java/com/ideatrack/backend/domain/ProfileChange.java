package com.ideatrack.backend.domain;

/**
 * @param before null on the first computation for this owner
 */
public record ProfileChange(
        UserAccuracyProfile before,
        UserAccuracyProfile after
) {}
