package com.analyzemyteam.timelinesync.presentation.dto;

/**
 * Manual annotation. Missing fields fall back to annotation defaults; out-of-range geometry is clamped.
 *
 * @param color {@code #RRGGBB} or {@code #RRGGBBAA}
 */
public record MarkerRequest(
        String markerId,
        long videoTimestamp,
        String label,
        String description,
        String color,
        Double heightScale,
        Integer priority
) {
}
