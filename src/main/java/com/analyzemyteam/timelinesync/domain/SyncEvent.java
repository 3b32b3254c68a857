package com.analyzemyteam.timelinesync.domain;

import com.analyzemyteam.timelinesync.exception.InvalidEventException;

import java.util.Objects;

/**
 * Time-stamped fact on the video timeline: a tagged union of {@link EventKind} and a matching
 * {@link EventPayload}.
 *
 * @param id              stable identifier, unique within its kind
 * @param kind            event kind
 * @param videoTimestamp  position on the video timeline in ms (never negative)
 * @param ingestTimestamp wall-clock ms when the event was received or created
 * @param confidence      confidence in [0,1]; out-of-range values are clamped
 * @param payload         kind-specific body
 * @param userCreated     true for manual overrides, which are never auto-evicted
 */
public record SyncEvent(
        String id,
        EventKind kind,
        long videoTimestamp,
        long ingestTimestamp,
        double confidence,
        EventPayload payload,
        boolean userCreated
) {

    public static final double DEFAULT_CONFIDENCE = 1.0;

    /**
     * Compact constructor with validation.
     *
     * @throws InvalidEventException when the id is blank, the kind is missing, the timestamp is
     *                               negative, the confidence is NaN or the payload does not match the kind
     */
    public SyncEvent {
        if (id == null || id.isBlank()) {
            throw new InvalidEventException("event id must not be blank");
        }
        if (kind == null) {
            throw new InvalidEventException(id, "event kind must not be null");
        }
        if (videoTimestamp < 0) {
            throw new InvalidEventException(id, "videoTimestamp must be >= 0, got: " + videoTimestamp);
        }
        if (Double.isNaN(confidence)) {
            throw new InvalidEventException(id, "confidence must be a number");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        if (payload == null) {
            throw new InvalidEventException(id, "payload must not be null");
        }
        if (payload.kind() != kind) {
            throw new InvalidEventException(id,
                    "payload " + payload.getClass().getSimpleName() + " does not match kind " + kind);
        }
    }

    public static SyncEvent of(String id, long videoTimestamp, long ingestTimestamp,
                               double confidence, EventPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return new SyncEvent(id, payload.kind(), videoTimestamp, ingestTimestamp, confidence, payload, false);
    }

    public static SyncEvent userCreated(String id, long videoTimestamp, long ingestTimestamp,
                                        double confidence, EventPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return new SyncEvent(id, payload.kind(), videoTimestamp, ingestTimestamp, confidence, payload, true);
    }

    public SyncEvent withPayload(EventPayload newPayload) {
        return new SyncEvent(id, kind, videoTimestamp, ingestTimestamp, confidence, newPayload, userCreated);
    }

    public SyncEvent withIngestTimestamp(long newIngestTimestamp) {
        return new SyncEvent(id, kind, videoTimestamp, newIngestTimestamp, confidence, payload, userCreated);
    }

    /** True when both events carry the same facts, ignoring when they were ingested. */
    public boolean sameContentAs(SyncEvent other) {
        return other != null
                && id.equals(other.id)
                && kind == other.kind
                && videoTimestamp == other.videoTimestamp
                && Double.compare(confidence, other.confidence) == 0
                && userCreated == other.userCreated
                && payload.equals(other.payload);
    }

    /** Convenience accessor; callers must check {@link #kind()} first. */
    public <T extends EventPayload> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
