package com.analyzemyteam.timelinesync.exception;

/**
 * Base exception for all timeline-sync application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TimelineSyncException extends RuntimeException {

    public TimelineSyncException(String message) {
        super(message);
    }

    public TimelineSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public TimelineSyncException(Throwable cause) {
        super(cause);
    }
}
