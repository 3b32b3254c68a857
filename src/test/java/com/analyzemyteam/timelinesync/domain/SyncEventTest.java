package com.analyzemyteam.timelinesync.domain;

import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncEventTest {

    private static final TriangleCallPayload CALL =
            new TriangleCallPayload(TriangleCallType.LEFT_HASH, "f1", "hash");

    @Test
    void rejectsBlankId() {
        assertThatThrownBy(() -> SyncEvent.of(" ", 0, 0, 1.0, CALL))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("id");
    }

    @Test
    void rejectsNegativeTimestamp() {
        assertThatThrownBy(() -> SyncEvent.of("e", -1, 0, 1.0, CALL))
                .isInstanceOf(InvalidEventException.class)
                .satisfies(ex -> assertThat(((InvalidEventException) ex).getEventId()).isEqualTo("e"));
    }

    @Test
    void rejectsNaNConfidence() {
        assertThatThrownBy(() -> SyncEvent.of("e", 0, 0, Double.NaN, CALL))
                .isInstanceOf(InvalidEventException.class);
    }

    @Test
    void rejectsPayloadOfAnotherKind() {
        assertThatThrownBy(() -> new SyncEvent("e", EventKind.FORMATION, 0, 0, 1.0, CALL, false))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void clampsConfidence() {
        assertThat(SyncEvent.of("e", 0, 0, 1.7, CALL).confidence()).isEqualTo(1.0);
        assertThat(SyncEvent.of("e", 0, 0, -0.2, CALL).confidence()).isEqualTo(0.0);
    }

    @Test
    void sameContentIgnoresIngestTimestamp() {
        SyncEvent a = SyncEvent.of("e", 10, 1, 0.5, CALL);

        assertThat(a.sameContentAs(a.withIngestTimestamp(99))).isTrue();
        assertThat(a.sameContentAs(SyncEvent.of("e", 11, 1, 0.5, CALL))).isFalse();
        assertThat(a.sameContentAs(null)).isFalse();
    }

    @Test
    void payloadDefaultsAreApplied() {
        FormationPayload formation = new FormationPayload(null, null, null, null, null, null);

        assertThat(formation.formationType()).isEqualTo(FormationType.UNKNOWN);
        assertThat(formation.recommendedCall()).isEqualTo(TriangleCallType.NO_CALL);
        assertThat(formation.playerPositions()).isEmpty();
        assertThat(formation.melScores()).isEqualTo(MelScores.EMPTY);
    }

    @Test
    void alertPriorityIsClamped() {
        assertThat(new CoachingAlertPayload("t", "m", List.of(), 9, false).priorityLevel()).isEqualTo(5);
        assertThat(new CoachingAlertPayload("t", "m", List.of(), 0, false).priorityLevel()).isEqualTo(1);
    }

    @Test
    void melStageRecomputesCombinedAsMean() {
        MelScorePayload scores = MelScorePayload.empty("f1")
                .withStage("making", 90, "completed")
                .withStage("efficiency", 60, "completed")
                .withStage("logical", 30, "completed");

        assertThat(scores.combinedScore()).isEqualTo(60.0);
        assertThat(scores.withStage("bogus", 10, "completed")).isSameAs(scores);
    }

    @Test
    void wireNamesRoundTripThroughEnums() {
        assertThat(EventKind.fromWire("coaching_alert")).contains(EventKind.COACHING_ALERT);
        assertThat(EventKind.fromWire("MEL_SCORE")).contains(EventKind.MEL_SCORE);
        assertThat(EventKind.fromWire("weather")).isEmpty();
        assertThat(FormationType.fromWire("ricky")).isEqualTo(FormationType.RICKY);
        assertThat(FormationType.fromWire("shotgun")).isEqualTo(FormationType.UNKNOWN);
        assertThat(TriangleCallType.fromWire("goal_line")).isEqualTo(TriangleCallType.GOAL_LINE);
        assertThat(TriangleCallType.STRONG_SIDE.displayName()).isEqualTo("Strong Side");
    }

    @Test
    void markerColorHexRoundTripAndClamping() {
        MarkerColor color = MarkerColor.rgb(0, 120, 215).withAlpha(150);

        assertThat(color.toHex()).isEqualTo("#0078D796");
        assertThat(MarkerColor.fromHex("#0078D796")).isEqualTo(color);
        assertThat(MarkerColor.fromHex("FF0000").alpha()).isEqualTo(255);
        assertThat(new MarkerColor(300, -5, 0, 0).red()).isEqualTo(255);
        assertThatThrownBy(() -> MarkerColor.fromHex("#123")).isInstanceOf(IllegalArgumentException.class);
    }
}
