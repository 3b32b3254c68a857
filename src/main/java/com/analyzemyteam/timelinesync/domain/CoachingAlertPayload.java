package com.analyzemyteam.timelinesync.domain;

import java.util.List;

/**
 * Coaching alert addressed to staff members.
 *
 * <p>{@code priorityLevel} is clamped into {@value #MIN_PRIORITY}..{@value #MAX_PRIORITY}.
 */
public record CoachingAlertPayload(
        String alertType,
        String message,
        List<String> targetStaff,
        int priorityLevel,
        boolean acknowledged
) implements EventPayload {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    public CoachingAlertPayload {
        alertType = alertType == null ? "" : alertType;
        message = message == null ? "" : message;
        targetStaff = targetStaff == null ? List.of() : List.copyOf(targetStaff);
        priorityLevel = Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priorityLevel));
    }

    @Override
    public EventKind kind() {
        return EventKind.COACHING_ALERT;
    }

    public CoachingAlertPayload acknowledge() {
        return new CoachingAlertPayload(alertType, message, targetStaff, priorityLevel, true);
    }
}
