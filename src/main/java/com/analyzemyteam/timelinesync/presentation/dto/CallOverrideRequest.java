package com.analyzemyteam.timelinesync.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record CallOverrideRequest(
        @PositiveOrZero long videoTimestamp,
        @NotBlank String call,
        String reason
) {
}
