package com.analyzemyteam.timelinesync.service.marker;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.Marker;
import com.analyzemyteam.timelinesync.domain.MarkerColor;
import com.analyzemyteam.timelinesync.domain.MarkerKind;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallPayload;

import java.util.Locale;

/**
 * Derives marker appearance from an event. Pure and deterministic: the same event always
 * yields the same marker.
 */
final class MarkerFactory {

    static final MarkerColor FORMATION_COLOR = MarkerColor.rgb(0, 120, 215);
    static final MarkerColor TRIANGLE_CALL_COLOR = MarkerColor.rgb(255, 69, 0);
    static final MarkerColor ALERT_COLOR = MarkerColor.rgb(255, 215, 0);
    static final MarkerColor CRITICAL_ALERT_COLOR = MarkerColor.rgb(255, 0, 0);
    static final MarkerColor MEL_HIGH_COLOR = MarkerColor.rgb(0, 255, 0);
    static final MarkerColor MEL_MEDIUM_COLOR = MarkerColor.rgb(255, 255, 0);
    static final MarkerColor MEL_LOW_COLOR = MarkerColor.rgb(255, 165, 0);
    static final MarkerColor ANNOTATION_COLOR = MarkerColor.rgb(128, 0, 128);

    static final double FORMATION_ANIMATION_CONFIDENCE = 0.8;
    static final double TRIANGLE_ANIMATION_CONFIDENCE = 0.8;
    static final int ALERT_ANIMATION_PRIORITY = 4;
    static final double MEL_ANIMATION_SCORE = 85.0;

    private MarkerFactory() {
    }

    static String markerId(SyncEvent event) {
        return event.kind().markerPrefix() + "_" + event.id();
    }

    static Marker fromEvent(SyncEvent event) {
        return switch (event.kind()) {
            case FORMATION -> formation(event, event.payloadAs(FormationPayload.class));
            case TRIANGLE_CALL -> triangleCall(event, event.payloadAs(TriangleCallPayload.class));
            case COACHING_ALERT -> alert(event, event.payloadAs(CoachingAlertPayload.class));
            case MEL_SCORE -> mel(event, event.payloadAs(MelScorePayload.class));
        };
    }

    /** Fills defaults for a manual annotation; geometry is clamped by {@link Marker}. */
    static Marker annotation(String markerId, long videoTimestamp, String label, String description,
                             MarkerColor color, double heightScale, int priority) {
        return new Marker(markerId, null, MarkerKind.MANUAL_ANNOTATION, videoTimestamp,
                label == null || label.isBlank() ? "Note" : label,
                description,
                color == null ? ANNOTATION_COLOR : color,
                heightScale <= 0 ? 0.5 : heightScale,
                priority < 0 ? 5 : priority,
                false,
                true);
    }

    private static Marker formation(SyncEvent event, FormationPayload payload) {
        double confidence = event.confidence();
        String type = capitalize(payload.formationType().wireName());
        String description = String.format(Locale.ROOT, "Formation: %s | Call: %s | Confidence: %d%%",
                type, payload.recommendedCall().displayName(), Math.round(confidence * 100));
        return new Marker(markerId(event), event.id(), MarkerKind.FORMATION, event.videoTimestamp(),
                type, description,
                FORMATION_COLOR.withAlpha(confidenceAlpha(confidence)),
                0.8,
                (int) Math.round(confidence * 10),
                confidence > FORMATION_ANIMATION_CONFIDENCE,
                event.userCreated());
    }

    private static Marker triangleCall(SyncEvent event, TriangleCallPayload payload) {
        double confidence = event.confidence();
        String description = payload.reason().isBlank()
                ? "Triangle call: " + payload.call().displayName()
                : "Triangle call: " + payload.call().displayName() + " (" + payload.reason() + ")";
        return new Marker(markerId(event), event.id(), MarkerKind.TRIANGLE_CALL, event.videoTimestamp(),
                payload.call().displayName(), description,
                TRIANGLE_CALL_COLOR.withAlpha(confidenceAlpha(confidence)),
                1.0,
                8,
                confidence > TRIANGLE_ANIMATION_CONFIDENCE,
                event.userCreated());
    }

    private static Marker alert(SyncEvent event, CoachingAlertPayload payload) {
        int level = payload.priorityLevel();
        boolean critical = level >= CoachingAlertPayload.MAX_PRIORITY;
        MarkerColor color = critical ? CRITICAL_ALERT_COLOR : ALERT_COLOR.withAlpha(150 + level * 20);
        String label = payload.alertType().isBlank() ? "Alert" : payload.alertType();
        return new Marker(markerId(event), event.id(), MarkerKind.COACHING_ALERT, event.videoTimestamp(),
                label, payload.message(),
                color,
                critical ? 1.0 : 0.2 + level * 0.15,
                critical ? Marker.MAX_PRIORITY : level * 2,
                level >= ALERT_ANIMATION_PRIORITY,
                event.userCreated());
    }

    private static Marker mel(SyncEvent event, MelScorePayload payload) {
        double combined = payload.combinedScore();
        MarkerColor color;
        if (combined >= 80.0) {
            color = MEL_HIGH_COLOR;
        } else if (combined >= 60.0) {
            color = MEL_MEDIUM_COLOR;
        } else {
            color = MEL_LOW_COLOR;
        }
        String description = String.format(Locale.ROOT, "MEL M:%.1f E:%.1f L:%.1f Combined:%.1f",
                payload.makingScore(), payload.efficiencyScore(), payload.logicalScore(), combined);
        return new Marker(markerId(event), event.id(), MarkerKind.MEL_SCORE, event.videoTimestamp(),
                "MEL " + Math.round(combined), description,
                color.withAlpha(confidenceAlpha(event.confidence())),
                combined / 100.0,
                (int) Math.round(combined / 10.0),
                combined > MEL_ANIMATION_SCORE,
                event.userCreated());
    }

    private static int confidenceAlpha(double confidence) {
        return (int) Math.round(150 + confidence * 105);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
