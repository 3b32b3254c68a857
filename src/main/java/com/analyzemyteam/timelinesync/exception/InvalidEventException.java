package com.analyzemyteam.timelinesync.exception;

/**
 * Thrown when an inbound event fails validation (negative timestamp, unknown kind,
 * payload/kind mismatch, malformed body). Invalid events are never stored.
 */
public class InvalidEventException extends TimelineSyncException {

    private final String eventId;
    private final String reason;

    public InvalidEventException(String reason) {
        super("Invalid event: " + reason);
        this.eventId = null;
        this.reason = reason;
    }

    public InvalidEventException(String eventId, String reason) {
        super("Invalid event (" + eventId + "): " + reason);
        this.eventId = eventId;
        this.reason = reason;
    }

    public InvalidEventException(String reason, Throwable cause) {
        super("Invalid event: " + reason, cause);
        this.eventId = null;
        this.reason = reason;
    }

    public String getEventId() {
        return eventId;
    }

    public String getReason() {
        return reason;
    }
}
