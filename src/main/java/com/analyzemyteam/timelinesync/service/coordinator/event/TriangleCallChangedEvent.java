package com.analyzemyteam.timelinesync.service.coordinator.event;

import com.analyzemyteam.timelinesync.domain.TriangleCallType;

import java.time.Instant;

/**
 * Published when the recommended call for the formation at the playhead changes.
 *
 * @param formationEventId id of the formation event carrying the new call
 */
public record TriangleCallChangedEvent(TriangleCallType previous,
                                       TriangleCallType current,
                                       String formationEventId,
                                       long videoTimestamp,
                                       Instant at) {
    public TriangleCallChangedEvent {
        at = at == null ? Instant.now() : at;
    }
}
