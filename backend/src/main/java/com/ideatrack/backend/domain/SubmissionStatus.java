package com.ideatrack.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubmissionStatus {
    SUBMITTED,
    VALIDATED,
    SUPERSEDED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubmissionStatus from(String value) {
        return SubmissionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
