package com.ideatrack.backend.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

public class LinkRequest {
    @NotBlank
    public String parentTrackingId;

    @NotBlank
    public String childTrackingId;

    @NotBlank
    public String refinementType;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public Double depthIncrease;

    public String question;
}
