package com.ideatrack.backend.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

public class SubmitIdeaRequest {
    @NotBlank
    public String ownerId;

    @NotBlank
    public String text;

    // null = 확신도 미선언
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public Double confidence;

    public String classification;
}
