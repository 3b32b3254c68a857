package com.analyzemyteam.timelinesync.service.coordinator;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScores;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class TriangleCallRulesTest {

    private static FormationPayload formation(FormationType type, String hash, String zone, double combinedMel) {
        return new FormationPayload(type, TriangleCallType.NO_CALL, hash, zone, List.of(),
                new MelScores(combinedMel, combinedMel, combinedMel, combinedMel));
    }

    @ParameterizedTest
    @CsvSource({
            "LARRY, '', Red Zone, GOAL_LINE",
            "RITA,  L,  RED ZONE, RED_ZONE",
            "RITA,  L,  midfield, LEFT_HASH",
            "LARRY, R,  '',       RIGHT_HASH",
            "RANDY, M,  '',       MIDDLE_HASH",
            "LINDA, '', '',       STRONG_SIDE",
            "RANDY, '', '',       WEAK_SIDE",
            "PAT,   '', '',       NO_CALL"
    })
    void determinesCallFromZoneThenHashThenFamily(FormationType type, String hash, String zone,
                                                   TriangleCallType expected) {
        assertThat(TriangleCallRules.determineCall(formation(type, hash, zone, 0.0))).isEqualTo(expected);
    }

    @Test
    void rickyDependsOnMelScore() {
        assertThat(TriangleCallRules.determineCall(formation(FormationType.RICKY, "", "", 71.0)))
                .isEqualTo(TriangleCallType.STRONG_SIDE);
        assertThat(TriangleCallRules.determineCall(formation(FormationType.RICKY, "", "", 70.0)))
                .isEqualTo(TriangleCallType.WEAK_SIDE);
    }

    @Test
    void urgencyCombinesFamilyZoneAndMel() {
        assertThat(TriangleCallRules.defensiveUrgency(formation(FormationType.RITA, "", "", 0.0), 1.0))
                .isEqualTo(0.6, offset(1e-9));
        assertThat(TriangleCallRules.defensiveUrgency(formation(FormationType.RICKY, "", "Goal Line", 90.0), 0.5))
                .isEqualTo(0.55, offset(1e-9));
        assertThat(TriangleCallRules.defensiveUrgency(formation(FormationType.LARRY, "", "red zone", 90.0), 1.0))
                .isEqualTo(1.0);
    }

    @Test
    void raisesAlertOnlyAboveThreshold() {
        FormationPayload payload = formation(FormationType.LINDA, "", "Red Zone", 0.0)
                .withRecommendedCall(TriangleCallType.GOAL_LINE);
        SyncEvent urgent = SyncEvent.of("formation_9", 4_000, 1, 0.95, payload);
        SyncEvent calm = SyncEvent.of("formation_10", 4_000, 1, 0.7, payload);

        SyncEvent alert = TriangleCallRules.urgencyAlert(urgent, 77).orElseThrow();

        assertThat(alert.id()).isEqualTo("urgency_formation_9");
        assertThat(alert.videoTimestamp()).isEqualTo(4_000L);
        assertThat(alert.ingestTimestamp()).isEqualTo(77L);
        CoachingAlertPayload body = alert.payloadAs(CoachingAlertPayload.class);
        assertThat(body.alertType()).isEqualTo("high_urgency_formation");
        assertThat(body.priorityLevel()).isEqualTo(4);
        assertThat(body.message()).isEqualTo("High urgency LINDA formation detected - Goal Line recommended");
        assertThat(TriangleCallRules.urgencyAlert(calm, 77)).isEmpty();
    }
}
