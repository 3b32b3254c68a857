package com.analyzemyteam.timelinesync.domain;

import java.time.Instant;

/**
 * Immutable snapshot of process-wide synchronization counters.
 *
 * @param averageLatencyMs rolling average over the most recent latency samples
 */
public record SyncStatistics(
        long eventsProcessed,
        long cacheHits,
        long cacheMisses,
        long syncOperations,
        long networkRequests,
        long droppedEvents,
        long evictedEvents,
        long persistenceFailures,
        double averageLatencyMs,
        Instant capturedAt
) {

    /** Share of lookups served from the cache, 0 when no lookup happened yet. */
    public double cacheHitRatio() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0.0 : (double) cacheHits / total;
    }
}
