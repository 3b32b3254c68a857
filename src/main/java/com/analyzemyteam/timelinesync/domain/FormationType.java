package com.analyzemyteam.timelinesync.domain;

import java.util.Locale;

/**
 * Offensive formation families recognised by the analytics backend.
 */
public enum FormationType {
    LARRY,
    LINDA,
    RITA,
    RICKY,
    RANDY,
    PAT,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Tight formations (LARRY, LINDA) flip red-zone calls to goal-line calls. */
    public boolean isTight() {
        return this == LARRY || this == LINDA;
    }

    /** Unrecognised or missing names map to {@link #UNKNOWN}. */
    public static FormationType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }
}
