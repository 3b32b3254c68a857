package com.analyzemyteam.timelinesync.service.marker.event;

import com.analyzemyteam.timelinesync.domain.Marker;

import java.time.Instant;

public record MarkerUpdatedEvent(Marker previous, Marker current, Instant at) {
    public MarkerUpdatedEvent {
        at = at == null ? Instant.now() : at;
    }
}
