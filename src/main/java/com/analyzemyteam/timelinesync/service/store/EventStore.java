package com.analyzemyteam.timelinesync.service.store;

import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.SyncEvent;

import java.util.List;

/**
 * Durable local cache of events used to repopulate the in-memory cache on startup and to
 * serve offline replay.
 *
 * <p>Write failures are non-fatal: implementations log them and keep going.
 */
public interface EventStore {

    /**
     * Loads the most recent events by video timestamp across all kinds.
     *
     * @param maxEvents upper bound on returned events
     * @return events ordered by video timestamp, newest first
     * @throws com.analyzemyteam.timelinesync.exception.EventStoreException if the store cannot be read
     */
    List<SyncEvent> load(int maxEvents);

    /**
     * Idempotent upsert by {@code (kind, id)}. Never throws for storage failures.
     */
    void save(SyncEvent event);

    /**
     * Same as {@link #save(SyncEvent)} but runs off the caller's thread.
     */
    void saveAsync(SyncEvent event);

    /**
     * Deletes non-user rows ingested more than {@code retentionHours} ago.
     *
     * @return number of deleted rows
     */
    int cleanup(int retentionHours);

    /** Removes one event; missing rows are ignored. */
    void delete(EventKind kind, String id);
}
