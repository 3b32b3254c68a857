package com.analyzemyteam.timelinesync.service.coordinator;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Triangle defense rules applied to detected formations.
 */
final class TriangleCallRules {

    static final double RICKY_STRONG_SIDE_MEL = 70.0;
    static final double HIGH_MEL = 85.0;
    static final double HIGH_URGENCY = 0.8;
    static final int URGENCY_ALERT_PRIORITY = 4;
    static final String URGENCY_ALERT_TYPE = "high_urgency_formation";
    static final String URGENCY_ID_PREFIX = "urgency_";

    private static final String RED_ZONE = "red zone";
    private static final String GOAL_LINE = "goal line";

    private TriangleCallRules() {
    }

    /**
     * Derives the recommended call from zone, hash and formation family, in that order.
     */
    static TriangleCallType determineCall(FormationPayload formation) {
        if (zoneMentions(formation, RED_ZONE)) {
            return formation.formationType().isTight() ? TriangleCallType.GOAL_LINE : TriangleCallType.RED_ZONE;
        }
        switch (formation.hashPosition()) {
            case "L":
                return TriangleCallType.LEFT_HASH;
            case "R":
                return TriangleCallType.RIGHT_HASH;
            case "M":
                return TriangleCallType.MIDDLE_HASH;
            default:
                break;
        }
        switch (formation.formationType()) {
            case LARRY:
            case LINDA:
                return TriangleCallType.STRONG_SIDE;
            case RITA:
            case RANDY:
                return TriangleCallType.WEAK_SIDE;
            case RICKY:
                return formation.melScores().combined() > RICKY_STRONG_SIDE_MEL
                        ? TriangleCallType.STRONG_SIDE
                        : TriangleCallType.WEAK_SIDE;
            default:
                return TriangleCallType.NO_CALL;
        }
    }

    /**
     * Urgency in [0,1] for the defense to react to a formation.
     */
    static double defensiveUrgency(FormationPayload formation, double confidence) {
        double urgency;
        switch (formation.formationType()) {
            case LARRY:
            case LINDA:
                urgency = 0.8;
                break;
            case RITA:
                urgency = 0.6;
                break;
            case RICKY:
            case RANDY:
                urgency = 0.4;
                break;
            default:
                urgency = 0.2;
        }
        if (zoneMentions(formation, RED_ZONE)) {
            urgency += 0.3;
        } else if (zoneMentions(formation, GOAL_LINE)) {
            urgency += 0.5;
        }
        if (formation.melScores().combined() > HIGH_MEL) {
            urgency += 0.2;
        }
        urgency *= confidence;
        return Math.max(0.0, Math.min(1.0, urgency));
    }

    /**
     * Builds the coaching alert raised for a high-urgency formation, if its urgency calls for one.
     */
    static Optional<SyncEvent> urgencyAlert(SyncEvent formationEvent, long ingestTimestamp) {
        FormationPayload formation = formationEvent.payloadAs(FormationPayload.class);
        if (defensiveUrgency(formation, formationEvent.confidence()) <= HIGH_URGENCY) {
            return Optional.empty();
        }
        String message = String.format(Locale.ROOT, "High urgency %s formation detected - %s recommended",
                formation.formationType().name(), formation.recommendedCall().displayName());
        CoachingAlertPayload alert = new CoachingAlertPayload(
                URGENCY_ALERT_TYPE, message, List.of(), URGENCY_ALERT_PRIORITY, false);
        return Optional.of(SyncEvent.of(URGENCY_ID_PREFIX + formationEvent.id(),
                formationEvent.videoTimestamp(), ingestTimestamp, formationEvent.confidence(), alert));
    }

    private static boolean zoneMentions(FormationPayload formation, String zone) {
        return formation.fieldZone().toLowerCase(Locale.ROOT).contains(zone);
    }
}
