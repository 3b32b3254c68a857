package com.analyzemyteam.timelinesync.service.remote.event;

import com.analyzemyteam.timelinesync.domain.ConnectionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Published on every remote connection state transition.
 *
 * @param reconnectAttempts reconnect attempts made since the last successful connect
 * @param reason            short cause, e.g. {@code heartbeat_timeout}
 */
public record ConnectionStateChangedEvent(
        ConnectionState previous,
        ConnectionState current,
        int reconnectAttempts,
        String reason,
        Instant at
) {
    public ConnectionStateChangedEvent {
        Objects.requireNonNull(current, "current");
        reason = reason == null ? "" : reason;
        at = at == null ? Instant.now() : at;
    }
}
