package com.analyzemyteam.timelinesync.service.marker.event;

import com.analyzemyteam.timelinesync.domain.Marker;

import java.time.Instant;

public record MarkerAddedEvent(Marker marker, Instant at) {
    public MarkerAddedEvent {
        at = at == null ? Instant.now() : at;
    }
}
