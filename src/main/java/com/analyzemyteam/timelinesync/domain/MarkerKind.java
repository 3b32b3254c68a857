package com.analyzemyteam.timelinesync.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Marker categories: one per event kind plus free-form annotations.
 */
public enum MarkerKind {
    FORMATION(EventKind.FORMATION),
    TRIANGLE_CALL(EventKind.TRIANGLE_CALL),
    COACHING_ALERT(EventKind.COACHING_ALERT),
    MEL_SCORE(EventKind.MEL_SCORE),
    MANUAL_ANNOTATION(null);

    private final EventKind eventKind;

    MarkerKind(EventKind eventKind) {
        this.eventKind = eventKind;
    }

    /** Source event kind, empty for annotations. */
    public Optional<EventKind> eventKind() {
        return Optional.ofNullable(eventKind);
    }

    public static MarkerKind of(EventKind kind) {
        for (MarkerKind mk : values()) {
            if (mk.eventKind == kind) {
                return mk;
            }
        }
        throw new IllegalArgumentException("No marker kind for " + kind);
    }

    public static Optional<MarkerKind> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MarkerKind mk : values()) {
            if (mk.name().equals(normalized)) {
                return Optional.of(mk);
            }
        }
        return EventKind.fromWire(value).map(MarkerKind::of);
    }
}
