package com.ideatrack.backend.service;

import com.ideatrack.backend.error.ValidationException;

final class Scores {

    private Scores() {
    }

    /** Null passes; anything else must be a finite number in [0,1]. */
    static void requireUnit(String field, Double value) {
        if (value == null) return;
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be within [0,1], got " + value);
        }
    }
}
