package com.analyzemyteam.timelinesync.service.stats;

import com.analyzemyteam.timelinesync.domain.SyncStatistics;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide synchronization counters behind a single lock.
 *
 * <p>Counters are monotonic until {@link #reset()}. Latency is a rolling average over the
 * most recent {@value #LATENCY_WINDOW} samples.
 */
@Component
public class SyncStatisticsTracker {

    static final int LATENCY_WINDOW = 100;

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> latencySamples = new ArrayDeque<>(LATENCY_WINDOW);

    private long eventsProcessed;
    private long cacheHits;
    private long cacheMisses;
    private long syncOperations;
    private long networkRequests;
    private long droppedEvents;
    private long evictedEvents;
    private long persistenceFailures;
    private long latencySum;

    public SyncStatisticsTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void recordEventProcessed() {
        add(Counter.EVENTS_PROCESSED, 1);
    }

    public void recordCacheHit() {
        add(Counter.CACHE_HITS, 1);
    }

    public void recordCacheMiss() {
        add(Counter.CACHE_MISSES, 1);
    }

    public void recordSyncOperation() {
        add(Counter.SYNC_OPERATIONS, 1);
    }

    public void recordNetworkRequest() {
        add(Counter.NETWORK_REQUESTS, 1);
    }

    public void recordDropped() {
        add(Counter.DROPPED, 1);
    }

    public void recordEvicted(int count) {
        if (count > 0) {
            add(Counter.EVICTED, count);
        }
    }

    public void recordPersistenceFailure() {
        add(Counter.PERSISTENCE_FAILURES, 1);
    }

    /**
     * Adds a latency sample; the oldest sample is discarded once the window is full.
     *
     * @param latencyMs latency in ms, negative values are ignored
     */
    public void recordLatency(long latencyMs) {
        if (latencyMs < 0) {
            return;
        }
        lock.lock();
        try {
            if (latencySamples.size() == LATENCY_WINDOW) {
                latencySum -= latencySamples.removeFirst();
            }
            latencySamples.addLast(latencyMs);
            latencySum += latencyMs;
        } finally {
            lock.unlock();
        }
    }

    public SyncStatistics snapshot() {
        lock.lock();
        try {
            double avg = latencySamples.isEmpty() ? 0.0 : (double) latencySum / latencySamples.size();
            return new SyncStatistics(eventsProcessed, cacheHits, cacheMisses, syncOperations,
                    networkRequests, droppedEvents, evictedEvents, persistenceFailures, avg, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            eventsProcessed = 0;
            cacheHits = 0;
            cacheMisses = 0;
            syncOperations = 0;
            networkRequests = 0;
            droppedEvents = 0;
            evictedEvents = 0;
            persistenceFailures = 0;
            latencySamples.clear();
            latencySum = 0;
        } finally {
            lock.unlock();
        }
    }

    private enum Counter {
        EVENTS_PROCESSED, CACHE_HITS, CACHE_MISSES, SYNC_OPERATIONS, NETWORK_REQUESTS,
        DROPPED, EVICTED, PERSISTENCE_FAILURES
    }

    private void add(Counter counter, long delta) {
        lock.lock();
        try {
            switch (counter) {
                case EVENTS_PROCESSED -> eventsProcessed += delta;
                case CACHE_HITS -> cacheHits += delta;
                case CACHE_MISSES -> cacheMisses += delta;
                case SYNC_OPERATIONS -> syncOperations += delta;
                case NETWORK_REQUESTS -> networkRequests += delta;
                case DROPPED -> droppedEvents += delta;
                case EVICTED -> evictedEvents += delta;
                case PERSISTENCE_FAILURES -> persistenceFailures += delta;
                default -> throw new IllegalStateException("Unhandled counter " + counter);
            }
        } finally {
            lock.unlock();
        }
    }
}
