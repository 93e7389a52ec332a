package com.ideatrack.backend.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public class OutcomeRequest {
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public Double result;

    @NotBlank
    public String validationSource;

    // ISO-8601, 생략 시 현재 시각
    public String validatedAt;

    public String validationUrl;
    public String validationNotes;
}
