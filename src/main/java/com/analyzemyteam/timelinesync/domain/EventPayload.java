package com.analyzemyteam.timelinesync.domain;

/**
 * Kind-specific body of a {@link SyncEvent}.
 *
 * <p>Implementations are immutable records. The payload's {@link #kind()} must match the
 * owning event's kind; {@link SyncEvent} rejects mismatches.
 */
public interface EventPayload {

    EventKind kind();
}
