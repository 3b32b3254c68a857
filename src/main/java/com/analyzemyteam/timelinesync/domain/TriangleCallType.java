package com.analyzemyteam.timelinesync.domain;

import java.util.Locale;

/**
 * Defensive triangle calls. Wire names are lower snake case ({@code strong_side}).
 */
public enum TriangleCallType {
    STRONG_SIDE,
    WEAK_SIDE,
    MIDDLE_HASH,
    LEFT_HASH,
    RIGHT_HASH,
    RED_ZONE,
    GOAL_LINE,
    NO_CALL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        String[] parts = name().split("_");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /** Unrecognised or missing names map to {@link #NO_CALL}. */
    public static TriangleCallType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NO_CALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return NO_CALL;
        }
    }
}
