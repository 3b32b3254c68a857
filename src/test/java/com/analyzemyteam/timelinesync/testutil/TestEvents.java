package com.analyzemyteam.timelinesync.testutil;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.MelScores;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;

import java.util.List;

/**
 * Builders for events used across tests.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public static SyncEvent formation(String id, long videoTs, long ingestTs, FormationType type, double confidence) {
        return SyncEvent.of(id, videoTs, ingestTs, confidence,
                new FormationPayload(type, TriangleCallType.STRONG_SIDE, "", "", List.of(), MelScores.EMPTY));
    }

    public static SyncEvent formation(String id, long videoTs, long ingestTs) {
        return formation(id, videoTs, ingestTs, FormationType.RITA, 0.5);
    }

    public static SyncEvent alert(String id, long videoTs, long ingestTs, int priority) {
        return SyncEvent.of(id, videoTs, ingestTs, 1.0,
                new CoachingAlertPayload("blitz_risk", "Watch the weak side", List.of("dc"), priority, false));
    }

    public static SyncEvent mel(String id, long videoTs, long ingestTs, double making, double efficiency, double logical) {
        return SyncEvent.of(id, videoTs, ingestTs, 1.0,
                new MelScorePayload("f1", making, efficiency, logical, (making + efficiency + logical) / 3.0, "completed"));
    }
}
