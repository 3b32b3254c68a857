package com.analyzemyteam.timelinesync.service.coordinator.event;

import java.time.Instant;
import java.util.List;

public record AnimatedMarkersChangedEvent(List<String> markerIds, long position, Instant at) {
    public AnimatedMarkersChangedEvent {
        markerIds = markerIds == null ? List.of() : List.copyOf(markerIds);
        at = at == null ? Instant.now() : at;
    }
}
