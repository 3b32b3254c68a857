package com.analyzemyteam.timelinesync.service.coordinator.event;

import java.time.Instant;

/**
 * Published when an inbound event is rejected by validation or queue backpressure.
 *
 * @param reason {@code invalid} or {@code queue_full}
 */
public record EventDroppedEvent(String eventId, String reason, String detail, Instant at) {
    public EventDroppedEvent {
        eventId = eventId == null ? "" : eventId;
        detail = detail == null ? "" : detail;
        at = at == null ? Instant.now() : at;
    }
}
