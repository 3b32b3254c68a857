package com.analyzemyteam.timelinesync.exception;

/**
 * Thrown when the local event store cannot complete an operation.
 * Persistence failures are non-fatal: callers log and continue with the in-memory cache.
 */
public class EventStoreException extends TimelineSyncException {

    private final String operation;

    public EventStoreException(String operation, String message, Throwable cause) {
        super("Event store " + operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
