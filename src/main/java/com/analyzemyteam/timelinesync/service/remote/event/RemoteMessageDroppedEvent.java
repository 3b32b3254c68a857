package com.analyzemyteam.timelinesync.service.remote.event;

import java.time.Instant;

/**
 * Published when a push message was malformed or failed validation.
 */
public record RemoteMessageDroppedEvent(String messageType, String reason, Instant at) {
    public RemoteMessageDroppedEvent {
        messageType = messageType == null ? "unknown" : messageType;
        reason = reason == null ? "" : reason;
        at = at == null ? Instant.now() : at;
    }
}
