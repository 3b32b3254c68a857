package com.analyzemyteam.timelinesync.service.marker.event;

import com.analyzemyteam.timelinesync.domain.MarkerKind;

import java.time.Instant;

/**
 * @param reason {@code deleted}, {@code source_removed}, {@code evicted}, {@code swept}, {@code cleared}
 */
public record MarkerRemovedEvent(String markerId, MarkerKind kind, String reason, Instant at) {
    public MarkerRemovedEvent {
        at = at == null ? Instant.now() : at;
    }
}
