package com.analyzemyteam.timelinesync.service.marker.event;

import com.analyzemyteam.timelinesync.domain.MarkerKind;

import java.time.Instant;

public record MarkerVisibilityChangedEvent(MarkerKind kind, boolean visible, Instant at) {
    public MarkerVisibilityChangedEvent {
        at = at == null ? Instant.now() : at;
    }
}
