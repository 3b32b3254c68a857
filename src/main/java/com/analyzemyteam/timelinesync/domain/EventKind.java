package com.analyzemyteam.timelinesync.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminator for the event union. Each kind owns one payload type and one marker prefix.
 */
public enum EventKind {
    FORMATION("formation", "formation", FormationPayload.class),
    TRIANGLE_CALL("triangle_call", "triangle", TriangleCallPayload.class),
    COACHING_ALERT("coaching_alert", "alert", CoachingAlertPayload.class),
    MEL_SCORE("mel_score", "mel", MelScorePayload.class);

    private final String wireName;
    private final String markerPrefix;
    private final Class<? extends EventPayload> payloadType;

    EventKind(String wireName, String markerPrefix, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.markerPrefix = markerPrefix;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public String markerPrefix() {
        return markerPrefix;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    /**
     * Resolves a kind from its wire name ({@code triangle_call}) or enum name ({@code TRIANGLE_CALL}).
     *
     * @param value raw value, may be null
     * @return matching kind, or empty when the value is unknown
     */
    public static Optional<EventKind> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventKind kind : values()) {
            if (kind.wireName.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
