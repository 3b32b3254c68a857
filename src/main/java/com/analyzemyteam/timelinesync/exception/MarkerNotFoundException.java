package com.analyzemyteam.timelinesync.exception;

/**
 * Thrown when a marker operation references an id the marker manager does not hold.
 */
public class MarkerNotFoundException extends TimelineSyncException {

    private final String markerId;

    public MarkerNotFoundException(String markerId) {
        super("Marker not found: " + markerId);
        this.markerId = markerId;
    }

    public String getMarkerId() {
        return markerId;
    }
}
