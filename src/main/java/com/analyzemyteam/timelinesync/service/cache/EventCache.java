package com.analyzemyteam.timelinesync.service.cache;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store of timeline events keyed by {@code (kind, videoTimestamp)} with
 * nearest-neighbour lookup and interpolation.
 *
 * <p>Lookup policy for {@link #at(EventKind, long)}:
 * <ol>
 *   <li>Exact timestamp match.</li>
 *   <li>If the nearest events strictly before and strictly after are both closer than the
 *       interpolation gap, a synthetic interpolated event.</li>
 *   <li>Otherwise the single closest event if it is closer than the nearest gap
 *       (ties favour the later event).</li>
 *   <li>Otherwise empty, counted as a miss.</li>
 * </ol>
 *
 * <p>All state is guarded by one lock. Upsert is last-write-wins on ingest time and idempotent.
 * When the size bound is exceeded the non-user events with the oldest ingest time are evicted.
 */
@Component
public class EventCache {

    private static final Logger LOG = LogManager.getLogger(EventCache.class);

    /** Among events sharing a timestamp, the most recently ingested one represents the slot. */
    private static final Comparator<SyncEvent> SLOT_ORDER = Comparator
            .comparingLong(SyncEvent::ingestTimestamp)
            .thenComparing(SyncEvent::id);

    private final SyncStatisticsTracker statistics;
    private final long interpolationMaxGapMs;
    private final long nearestMaxGapMs;
    private final int maxEvents;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<EventKind, NavigableMap<Long, Map<String, SyncEvent>>> timeline = new EnumMap<>(EventKind.class);
    private final Map<EventKind, Map<String, SyncEvent>> byId = new EnumMap<>(EventKind.class);
    private final TreeSet<IngestKey> evictionOrder = new TreeSet<>();
    private int size;

    @Autowired
    public EventCache(SyncProperties properties, SyncStatisticsTracker statistics) {
        this(statistics, properties.getInterpolationMaxGapMs(), properties.getNearestMaxGapMs(),
                properties.getMaxCachedEvents());
    }

    EventCache(SyncStatisticsTracker statistics, long interpolationMaxGapMs, long nearestMaxGapMs, int maxEvents) {
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        if (interpolationMaxGapMs <= 0 || nearestMaxGapMs <= 0 || maxEvents <= 0) {
            throw new IllegalArgumentException("Cache bounds must be positive");
        }
        this.interpolationMaxGapMs = interpolationMaxGapMs;
        this.nearestMaxGapMs = nearestMaxGapMs;
        this.maxEvents = maxEvents;
        for (EventKind kind : EventKind.values()) {
            timeline.put(kind, new TreeMap<>());
            byId.put(kind, new HashMap<>());
        }
    }

    /**
     * Inserts or replaces an event by {@code (kind, id)}.
     *
     * @param event validated event
     * @return what happened to the cache
     */
    public UpsertResult upsert(SyncEvent event) {
        Objects.requireNonNull(event, "event");
        List<SyncEvent> evicted;
        UpsertResult.Outcome outcome;
        lock.lock();
        try {
            SyncEvent existing = byId.get(event.kind()).get(event.id());
            if (existing == null) {
                put(event);
                outcome = UpsertResult.Outcome.INSERTED;
            } else if (event.ingestTimestamp() < existing.ingestTimestamp()) {
                return UpsertResult.of(UpsertResult.Outcome.STALE);
            } else if (event.sameContentAs(existing)) {
                return UpsertResult.of(UpsertResult.Outcome.UNCHANGED);
            } else {
                detach(existing);
                put(event);
                outcome = UpsertResult.Outcome.UPDATED;
            }
            evicted = evictOverflow();
        } finally {
            lock.unlock();
        }
        if (!evicted.isEmpty()) {
            statistics.recordEvicted(evicted.size());
            LOG.debug("Evicted {} cached events over bound {}", evicted.size(), maxEvents);
        }
        return new UpsertResult(outcome, evicted);
    }

    /**
     * Resolves the event for a kind at a video position. Every call counts as a hit or a miss.
     */
    public Optional<SyncEvent> at(EventKind kind, long position) {
        Objects.requireNonNull(kind, "kind");
        Optional<SyncEvent> found;
        lock.lock();
        try {
            found = resolve(kind, position);
        } finally {
            lock.unlock();
        }
        if (found.isPresent()) {
            statistics.recordCacheHit();
        } else {
            statistics.recordCacheMiss();
        }
        return found;
    }

    /**
     * Events of a kind with {@code start <= videoTimestamp <= end}, ascending by timestamp.
     * A non-empty result counts as a hit, an empty one as a miss.
     */
    public List<SyncEvent> range(EventKind kind, long start, long end) {
        Objects.requireNonNull(kind, "kind");
        List<SyncEvent> result = new ArrayList<>();
        if (end >= start) {
            lock.lock();
            try {
                for (Map<String, SyncEvent> slot : timeline.get(kind).subMap(start, true, end, true).values()) {
                    List<SyncEvent> sorted = new ArrayList<>(slot.values());
                    sorted.sort(Comparator.comparing(SyncEvent::id));
                    result.addAll(sorted);
                }
            } finally {
                lock.unlock();
            }
        }
        if (result.isEmpty()) {
            statistics.recordCacheMiss();
        } else {
            statistics.recordCacheHit();
        }
        return result;
    }

    public Optional<SyncEvent> findById(EventKind kind, String id) {
        lock.lock();
        try {
            return Optional.ofNullable(byId.get(kind).get(id));
        } finally {
            lock.unlock();
        }
    }

    public Optional<SyncEvent> remove(EventKind kind, String id) {
        lock.lock();
        try {
            SyncEvent existing = byId.get(kind).get(id);
            if (existing == null) {
                return Optional.empty();
            }
            detach(existing);
            return Optional.of(existing);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes non-user events ingested before {@code cutoffIngestMs}.
     *
     * @return removed events
     */
    public List<SyncEvent> evictIngestedBefore(long cutoffIngestMs) {
        List<SyncEvent> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<IngestKey> it = evictionOrder.iterator();
            while (it.hasNext()) {
                IngestKey key = it.next();
                if (key.ingestTimestamp() >= cutoffIngestMs) {
                    break;
                }
                SyncEvent event = byId.get(key.kind()).get(key.id());
                it.remove();
                if (event != null) {
                    detachFromIndexes(event);
                    removed.add(event);
                }
            }
        } finally {
            lock.unlock();
        }
        statistics.recordEvicted(removed.size());
        return removed;
    }

    /**
     * Coaching alerts not yet acknowledged, highest priority first, then latest on the timeline.
     */
    public List<SyncEvent> activeAlerts() {
        List<SyncEvent> alerts;
        lock.lock();
        try {
            alerts = new ArrayList<>(byId.get(EventKind.COACHING_ALERT).values());
        } finally {
            lock.unlock();
        }
        alerts.removeIf(e -> e.payloadAs(CoachingAlertPayload.class).acknowledged());
        alerts.sort(Comparator
                .comparingInt((SyncEvent e) -> e.payloadAs(CoachingAlertPayload.class).priorityLevel())
                .thenComparingLong(SyncEvent::videoTimestamp)
                .reversed());
        return alerts;
    }

    /** All cached events of every kind. */
    public List<SyncEvent> snapshot() {
        lock.lock();
        try {
            List<SyncEvent> all = new ArrayList<>(size);
            for (Map<String, SyncEvent> events : byId.values()) {
                all.addAll(events.values());
            }
            return all;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            timeline.values().forEach(Map::clear);
            byId.values().forEach(Map::clear);
            evictionOrder.clear();
            size = 0;
        } finally {
            lock.unlock();
        }
    }

    // --- lock must be held by callers of the methods below ---

    private Optional<SyncEvent> resolve(EventKind kind, long position) {
        NavigableMap<Long, Map<String, SyncEvent>> events = timeline.get(kind);
        Map<String, SyncEvent> exact = events.get(position);
        if (exact != null) {
            return Optional.of(representative(exact.values()));
        }

        Map.Entry<Long, Map<String, SyncEvent>> lower = events.lowerEntry(position);
        Map.Entry<Long, Map<String, SyncEvent>> higher = events.higherEntry(position);
        long beforeGap = lower == null ? Long.MAX_VALUE : position - lower.getKey();
        long afterGap = higher == null ? Long.MAX_VALUE : higher.getKey() - position;

        if (lower != null && higher != null
                && beforeGap < interpolationMaxGapMs && afterGap < interpolationMaxGapMs) {
            return Optional.of(EventInterpolator.interpolate(
                    representative(lower.getValue().values()),
                    representative(higher.getValue().values()),
                    position));
        }

        // ties favour the later event
        if (higher != null && afterGap <= beforeGap && afterGap < nearestMaxGapMs) {
            return Optional.of(representative(higher.getValue().values()));
        }
        if (lower != null && beforeGap < nearestMaxGapMs) {
            return Optional.of(representative(lower.getValue().values()));
        }
        return Optional.empty();
    }

    private static SyncEvent representative(Collection<SyncEvent> slot) {
        return slot.stream().max(SLOT_ORDER).orElseThrow();
    }

    private void put(SyncEvent event) {
        timeline.get(event.kind())
                .computeIfAbsent(event.videoTimestamp(), ts -> new HashMap<>())
                .put(event.id(), event);
        byId.get(event.kind()).put(event.id(), event);
        if (!event.userCreated()) {
            evictionOrder.add(IngestKey.of(event));
        }
        size++;
    }

    private void detach(SyncEvent event) {
        if (!event.userCreated()) {
            evictionOrder.remove(IngestKey.of(event));
        }
        detachFromIndexes(event);
    }

    private void detachFromIndexes(SyncEvent event) {
        NavigableMap<Long, Map<String, SyncEvent>> events = timeline.get(event.kind());
        Map<String, SyncEvent> slot = events.get(event.videoTimestamp());
        if (slot != null) {
            slot.remove(event.id());
            if (slot.isEmpty()) {
                events.remove(event.videoTimestamp());
            }
        }
        if (byId.get(event.kind()).remove(event.id()) != null) {
            size--;
        }
    }

    private List<SyncEvent> evictOverflow() {
        List<SyncEvent> evicted = new ArrayList<>();
        while (size > maxEvents) {
            IngestKey oldest = evictionOrder.pollFirst();
            if (oldest == null) {
                LOG.warn("Cache holds {} events over bound {} but all are user-created", size, maxEvents);
                break;
            }
            SyncEvent event = byId.get(oldest.kind()).get(oldest.id());
            if (event != null) {
                detachFromIndexes(event);
                evicted.add(event);
            }
        }
        return evicted;
    }

    /** Eviction order: oldest ingest first. */
    private record IngestKey(long ingestTimestamp, EventKind kind, String id) implements Comparable<IngestKey> {

        static IngestKey of(SyncEvent event) {
            return new IngestKey(event.ingestTimestamp(), event.kind(), event.id());
        }

        @Override
        public int compareTo(IngestKey other) {
            int c = Long.compare(ingestTimestamp, other.ingestTimestamp);
            if (c != 0) {
                return c;
            }
            c = kind.compareTo(other.kind);
            return c != 0 ? c : id.compareTo(other.id);
        }
    }
}
