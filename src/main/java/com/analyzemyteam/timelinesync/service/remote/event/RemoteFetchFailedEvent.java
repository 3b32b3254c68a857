package com.analyzemyteam.timelinesync.service.remote.event;

import java.time.Instant;

/**
 * Published when a fetch window could not be retrieved after all retries.
 */
public record RemoteFetchFailedEvent(long fromMs, long toMs, int attempts, String reason, Instant at) {
    public RemoteFetchFailedEvent {
        reason = reason == null ? "" : reason;
        at = at == null ? Instant.now() : at;
    }
}
