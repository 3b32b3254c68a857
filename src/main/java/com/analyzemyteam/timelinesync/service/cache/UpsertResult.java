package com.analyzemyteam.timelinesync.service.cache;

import com.analyzemyteam.timelinesync.domain.SyncEvent;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link EventCache#upsert}.
 *
 * @param outcome what happened to the upserted event
 * @param evicted events pushed out of the cache by the size bound, oldest ingest first; may
 *                include the upserted event itself
 */
public record UpsertResult(Outcome outcome, List<SyncEvent> evicted) {

    public enum Outcome {
        /** New (kind, id). */
        INSERTED,
        /** Existing entry replaced with different content. */
        UPDATED,
        /** Same content already stored; nothing changed. */
        UNCHANGED,
        /** Incoming event was ingested before the stored one and was ignored. */
        STALE
    }

    public UpsertResult {
        Objects.requireNonNull(outcome, "outcome");
        evicted = evicted == null ? List.of() : List.copyOf(evicted);
    }

    static UpsertResult of(Outcome outcome) {
        return new UpsertResult(outcome, List.of());
    }

    /** True when downstream views (markers, store) need to be refreshed. */
    public boolean changed() {
        return outcome == Outcome.INSERTED || outcome == Outcome.UPDATED;
    }
}
