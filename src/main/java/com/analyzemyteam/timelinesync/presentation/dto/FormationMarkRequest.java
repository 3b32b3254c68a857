package com.analyzemyteam.timelinesync.presentation.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record FormationMarkRequest(
        @PositiveOrZero long videoTimestamp,
        @NotBlank String formationType,
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidence
) {
}
