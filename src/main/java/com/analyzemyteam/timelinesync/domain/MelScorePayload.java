package com.analyzemyteam.timelinesync.domain;

/**
 * MEL pipeline result for a formation.
 *
 * @param stageStatus status of the last reported stage ({@code completed}, {@code running}, ...)
 */
public record MelScorePayload(
        String formationId,
        double makingScore,
        double efficiencyScore,
        double logicalScore,
        double combinedScore,
        String stageStatus
) implements EventPayload {

    public MelScorePayload {
        formationId = formationId == null ? "" : formationId;
        stageStatus = stageStatus == null ? "" : stageStatus;
    }

    @Override
    public EventKind kind() {
        return EventKind.MEL_SCORE;
    }

    public MelScores scores() {
        return new MelScores(makingScore, efficiencyScore, logicalScore, combinedScore);
    }

    /**
     * Applies one completed stage score and recomputes the combined score as the mean of all three.
     *
     * @param stage {@code making}, {@code efficiency} or {@code logical}
     * @param score stage score
     * @param status stage status reported with the score
     * @return updated payload, or this payload unchanged when the stage name is unknown
     */
    public MelScorePayload withStage(String stage, double score, String status) {
        double making = makingScore;
        double efficiency = efficiencyScore;
        double logical = logicalScore;
        switch (stage == null ? "" : stage) {
            case "making" -> making = score;
            case "efficiency" -> efficiency = score;
            case "logical" -> logical = score;
            default -> {
                return this;
            }
        }
        return new MelScorePayload(formationId, making, efficiency, logical,
                (making + efficiency + logical) / 3.0, status);
    }

    public static MelScorePayload empty(String formationId) {
        return new MelScorePayload(formationId, 0.0, 0.0, 0.0, 0.0, "");
    }
}
