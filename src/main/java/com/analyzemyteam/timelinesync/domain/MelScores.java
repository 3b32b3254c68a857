package com.analyzemyteam.timelinesync.domain;

/**
 * Making / Efficiency / Logical scores (0-100) attached to a formation.
 */
public record MelScores(double making, double efficiency, double logical, double combined) {

    public static final MelScores EMPTY = new MelScores(0.0, 0.0, 0.0, 0.0);

    /** Builds scores whose combined value is the mean of the three stages. */
    public static MelScores ofStages(double making, double efficiency, double logical) {
        return new MelScores(making, efficiency, logical, (making + efficiency + logical) / 3.0);
    }

    public MelScores interpolate(MelScores later, double ratio) {
        return new MelScores(
                lerp(making, later.making, ratio),
                lerp(efficiency, later.efficiency, ratio),
                lerp(logical, later.logical, ratio),
                lerp(combined, later.combined, ratio));
    }

    static double lerp(double from, double to, double ratio) {
        return from + (to - from) * ratio;
    }
}
