package com.analyzemyteam.timelinesync.exception;

/**
 * Thrown inside the remote client when a fetch or push-channel operation fails.
 * Never escapes the client boundary; surfaces only as connection state and telemetry.
 */
public class RemoteSyncException extends TimelineSyncException {

    private final String operation;
    private final int statusCode;

    public RemoteSyncException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
        this.statusCode = -1;
    }

    public RemoteSyncException(String operation, int statusCode, String message) {
        super(operation + " failed (HTTP " + statusCode + "): " + message);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public RemoteSyncException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
        this.statusCode = -1;
    }

    public String getOperation() {
        return operation;
    }

    /** HTTP status when the failure came from a response, otherwise -1. */
    public int getStatusCode() {
        return statusCode;
    }
}
