package com.analyzemyteam.timelinesync.domain;

import java.util.List;
import java.util.Objects;

/**
 * Detected offensive formation.
 *
 * @param formationType detected family
 * @param recommendedCall triangle call for this formation ({@link TriangleCallType#NO_CALL} if none)
 * @param hashPosition ball hash: {@code L}, {@code M} or {@code R} (may be empty)
 * @param fieldZone free-form zone, e.g. {@code "Red Zone"}
 * @param playerPositions positions of detected players
 * @param melScores MEL pipeline scores, {@link MelScores#EMPTY} until the pipeline reports
 */
public record FormationPayload(
        FormationType formationType,
        TriangleCallType recommendedCall,
        String hashPosition,
        String fieldZone,
        List<PlayerPosition> playerPositions,
        MelScores melScores
) implements EventPayload {

    public FormationPayload {
        formationType = formationType == null ? FormationType.UNKNOWN : formationType;
        recommendedCall = recommendedCall == null ? TriangleCallType.NO_CALL : recommendedCall;
        hashPosition = hashPosition == null ? "" : hashPosition;
        fieldZone = fieldZone == null ? "" : fieldZone;
        playerPositions = playerPositions == null ? List.of() : List.copyOf(playerPositions);
        melScores = Objects.requireNonNullElse(melScores, MelScores.EMPTY);
    }

    @Override
    public EventKind kind() {
        return EventKind.FORMATION;
    }

    public FormationPayload withRecommendedCall(TriangleCallType call) {
        return new FormationPayload(formationType, call, hashPosition, fieldZone, playerPositions, melScores);
    }

    public FormationPayload withMelScores(MelScores scores) {
        return new FormationPayload(formationType, recommendedCall, hashPosition, fieldZone, playerPositions, scores);
    }
}
