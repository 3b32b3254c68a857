package com.analyzemyteam.timelinesync.domain;

import java.time.Instant;

/**
 * Snapshot of the remote connection.
 *
 * @param lastHeartbeatAck last heartbeat acknowledgment, or null if none was received yet
 */
public record ConnectionStatus(ConnectionState state, int reconnectAttemptCount, Instant lastHeartbeatAck) {
}
