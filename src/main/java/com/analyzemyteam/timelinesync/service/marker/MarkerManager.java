package com.analyzemyteam.timelinesync.service.marker;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.Marker;
import com.analyzemyteam.timelinesync.domain.MarkerColor;
import com.analyzemyteam.timelinesync.domain.MarkerKind;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.exception.MarkerNotFoundException;
import com.analyzemyteam.timelinesync.service.marker.event.MarkerAddedEvent;
import com.analyzemyteam.timelinesync.service.marker.event.MarkerRemovedEvent;
import com.analyzemyteam.timelinesync.service.marker.event.MarkerUpdatedEvent;
import com.analyzemyteam.timelinesync.service.marker.event.MarkerVisibilityChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the timeline markers derived from cached events plus manual annotations.
 *
 * <p>Markers are held by value in creation order with a timestamp index. Every kind has a
 * visibility flag; hidden markers are kept but filtered out of queries, so toggling a kind is
 * retroactive without recomputation. Marker events are published after the lock is released.
 *
 * <p>Bounds: beyond {@code sync.max-markers} the oldest-created non-user markers are evicted;
 * {@link #sweep(long)} removes non-user markers far behind the playhead. User markers are never
 * removed automatically.
 */
@Component
public class MarkerManager {

    private static final Logger LOG = LogManager.getLogger(MarkerManager.class);

    static final String EXPORT_VERSION = "1.0";

    private static final Comparator<Marker> TIMELINE_ORDER = Comparator
            .comparingLong(Marker::videoTimestamp)
            .thenComparing(Marker::markerId);

    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final int maxMarkers;
    private final long nearestToleranceMs;
    private final long retentionMs;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Marker> markers = new LinkedHashMap<>();
    private final NavigableMap<Long, Set<String>> timeIndex = new TreeMap<>();
    private final Map<MarkerKind, Boolean> visibility = new EnumMap<>(MarkerKind.class);
    private final AtomicLong manualSequence = new AtomicLong();

    @Autowired
    public MarkerManager(SyncProperties properties, ApplicationEventPublisher publisher, Clock clock) {
        this(publisher, clock, properties.getMaxMarkers(),
                properties.getMarkers().getNearestToleranceMs(), properties.getMarkers().getRetentionMs());
    }

    MarkerManager(ApplicationEventPublisher publisher, Clock clock, int maxMarkers,
                  long nearestToleranceMs, long retentionMs) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxMarkers = maxMarkers;
        this.nearestToleranceMs = nearestToleranceMs;
        this.retentionMs = retentionMs;
        for (MarkerKind kind : MarkerKind.values()) {
            visibility.put(kind, Boolean.TRUE);
        }
    }

    /**
     * Creates or refreshes the marker derived from an event.
     *
     * @return the marker as stored
     */
    public Marker onEventUpserted(SyncEvent event) {
        Marker derived = MarkerFactory.fromEvent(event);
        List<Object> outbound = new ArrayList<>();
        lock.lock();
        try {
            Marker previous = markers.get(derived.markerId());
            if (derived.equals(previous)) {
                return previous;
            }
            store(derived, previous);
            boolean visible = isVisibleLocked(derived.kind());
            if (previous == null) {
                if (visible) {
                    outbound.add(new MarkerAddedEvent(derived, clock.instant()));
                }
            } else if (visible) {
                outbound.add(new MarkerUpdatedEvent(previous, derived, clock.instant()));
            }
            evictOverflow(outbound);
        } finally {
            lock.unlock();
        }
        publishAll(outbound);
        return derived;
    }

    /** Removes the marker of a deleted source event, if any. */
    public boolean onEventRemoved(EventKind kind, String eventId) {
        String markerId = kind.markerPrefix() + "_" + eventId;
        return removeInternal(markerId, "source_removed").isPresent();
    }

    /**
     * Adds a manual annotation. A blank id gets a generated one; geometry is clamped into range
     * and negative timestamps are clamped to zero.
     *
     * @return the stored marker
     */
    public Marker addMarker(String markerId, long videoTimestamp, String label, String description,
                            MarkerColor color, double heightScale, int priority) {
        String id = (markerId == null || markerId.isBlank())
                ? "manual_" + clock.millis() + "_" + manualSequence.incrementAndGet()
                : markerId;
        Marker marker = MarkerFactory.annotation(id, videoTimestamp, label, description, color, heightScale, priority);
        List<Object> outbound = new ArrayList<>();
        lock.lock();
        try {
            Marker previous = markers.get(id);
            store(marker, previous);
            if (isVisibleLocked(marker.kind())) {
                outbound.add(previous == null
                        ? new MarkerAddedEvent(marker, clock.instant())
                        : new MarkerUpdatedEvent(previous, marker, clock.instant()));
            }
            evictOverflow(outbound);
        } finally {
            lock.unlock();
        }
        publishAll(outbound);
        LOG.debug("Added marker {} at {}", id, marker.videoTimestamp());
        return marker;
    }

    /**
     * Deletes a marker explicitly.
     *
     * @throws MarkerNotFoundException when no marker has this id
     */
    public Marker removeMarker(String markerId) {
        return removeInternal(markerId, "deleted").orElseThrow(() -> new MarkerNotFoundException(markerId));
    }

    public Optional<Marker> findMarker(String markerId) {
        lock.lock();
        try {
            return Optional.ofNullable(markers.get(markerId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Visible markers with {@code start <= videoTimestamp <= end}, ascending.
     */
    public List<Marker> markersInRange(long start, long end) {
        List<Marker> result = new ArrayList<>();
        if (end < start) {
            return result;
        }
        lock.lock();
        try {
            for (Set<String> ids : timeIndex.subMap(start, true, end, true).values()) {
                for (String id : ids) {
                    Marker m = markers.get(id);
                    if (m != null && isVisibleLocked(m.kind())) {
                        result.add(m);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        result.sort(TIMELINE_ORDER);
        return result;
    }

    /**
     * Closest visible marker of a kind within the nearest-marker tolerance. Ties favour the later marker.
     */
    public Optional<Marker> nearestMarker(long position, MarkerKind kind) {
        Objects.requireNonNull(kind, "kind");
        lock.lock();
        try {
            if (!isVisibleLocked(kind)) {
                return Optional.empty();
            }
            Marker best = null;
            long bestDistance = Long.MAX_VALUE;
            long from = Math.max(0L, position - nearestToleranceMs);
            for (Set<String> ids : timeIndex.subMap(from, true, position + nearestToleranceMs, true).values()) {
                for (String id : ids) {
                    Marker m = markers.get(id);
                    if (m == null || m.kind() != kind) {
                        continue;
                    }
                    long distance = Math.abs(m.videoTimestamp() - position);
                    // ascending iteration: an equal distance later on is the later marker
                    if (distance <= bestDistance) {
                        best = m;
                        bestDistance = distance;
                    }
                }
            }
            return Optional.ofNullable(best);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of visible animated markers within {@code window} ms of the position, ascending by time.
     */
    public List<String> animatedMarkersNear(long position, long window) {
        List<Marker> near = markersInRange(Math.max(0L, position - window), position + window);
        List<String> ids = new ArrayList<>();
        for (Marker m : near) {
            if (m.animated()) {
                ids.add(m.markerId());
            }
        }
        return ids;
    }

    public void setVisibility(MarkerKind kind, boolean visible) {
        Objects.requireNonNull(kind, "kind");
        Boolean previous;
        lock.lock();
        try {
            previous = visibility.put(kind, visible);
        } finally {
            lock.unlock();
        }
        if (previous == null || previous != visible) {
            LOG.info("Marker visibility for {} set to {}", kind, visible);
            publisher.publishEvent(new MarkerVisibilityChangedEvent(kind, visible, clock.instant()));
        }
    }

    public boolean isVisible(MarkerKind kind) {
        lock.lock();
        try {
            return isVisibleLocked(kind);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes non-user markers more than the retention window behind {@code currentPosition}.
     *
     * @return number of removed markers
     */
    public int sweep(long currentPosition) {
        long cutoff = currentPosition - retentionMs;
        if (cutoff <= 0) {
            return 0;
        }
        List<Object> outbound = new ArrayList<>();
        lock.lock();
        try {
            List<String> expired = new ArrayList<>();
            for (Set<String> ids : timeIndex.headMap(cutoff, false).values()) {
                for (String id : ids) {
                    Marker m = markers.get(id);
                    if (m != null && !m.userCreated()) {
                        expired.add(id);
                    }
                }
            }
            for (String id : expired) {
                Marker removed = detach(id);
                outbound.add(new MarkerRemovedEvent(id, removed.kind(), "swept", clock.instant()));
            }
        } finally {
            lock.unlock();
        }
        publishAll(outbound);
        if (!outbound.isEmpty()) {
            LOG.debug("Swept {} markers older than {}", outbound.size(), cutoff);
        }
        return outbound.size();
    }

    public int size() {
        lock.lock();
        try {
            return markers.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        List<Object> outbound = new ArrayList<>();
        lock.lock();
        try {
            for (Marker m : markers.values()) {
                outbound.add(new MarkerRemovedEvent(m.markerId(), m.kind(), "cleared", clock.instant()));
            }
            markers.clear();
            timeIndex.clear();
        } finally {
            lock.unlock();
        }
        publishAll(outbound);
    }

    /**
     * Serializes all markers (visible or not) with per-kind counts.
     */
    public String exportJson() {
        List<Marker> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(markers.values());
        } finally {
            lock.unlock();
        }
        snapshot.sort(TIMELINE_ORDER);
        JSONArray items = new JSONArray();
        Map<MarkerKind, Integer> counts = new EnumMap<>(MarkerKind.class);
        for (Marker m : snapshot) {
            items.put(toJson(m));
            counts.merge(m.kind(), 1, Integer::sum);
        }
        JSONObject byKind = new JSONObject();
        counts.forEach((kind, count) -> byKind.put(kind.name(), count));
        return new JSONObject()
                .put("version", EXPORT_VERSION)
                .put("exported_at", clock.millis())
                .put("markers", items)
                .put("statistics", new JSONObject().put("total", snapshot.size()).put("by_kind", byKind))
                .toString();
    }

    /**
     * Imports markers from {@link #exportJson()} output. Existing markers with the same id are replaced.
     *
     * @return number of imported markers
     * @throws IllegalArgumentException when the document is malformed or has an unsupported version
     */
    public int importJson(String json) {
        List<Marker> imported = new ArrayList<>();
        try {
            JSONObject root = new JSONObject(json);
            String version = root.optString("version", "");
            if (!EXPORT_VERSION.equals(version)) {
                throw new IllegalArgumentException("Unsupported marker export version: " + version);
            }
            JSONArray items = root.optJSONArray("markers");
            if (items == null) {
                throw new IllegalArgumentException("Marker export has no markers array");
            }
            for (int i = 0; i < items.length(); i++) {
                imported.add(fromJson(items.getJSONObject(i)));
            }
        } catch (JSONException ex) {
            throw new IllegalArgumentException("Malformed marker export: " + ex.getMessage(), ex);
        }

        List<Object> outbound = new ArrayList<>();
        lock.lock();
        try {
            for (Marker m : imported) {
                Marker previous = markers.get(m.markerId());
                store(m, previous);
                if (isVisibleLocked(m.kind())) {
                    outbound.add(previous == null
                            ? new MarkerAddedEvent(m, clock.instant())
                            : new MarkerUpdatedEvent(previous, m, clock.instant()));
                }
            }
            evictOverflow(outbound);
        } finally {
            lock.unlock();
        }
        publishAll(outbound);
        LOG.info("Imported {} markers", imported.size());
        return imported.size();
    }

    // --- lock must be held by callers of the methods below ---

    private boolean isVisibleLocked(MarkerKind kind) {
        return visibility.getOrDefault(kind, Boolean.TRUE);
    }

    private void store(Marker marker, Marker previous) {
        if (previous != null) {
            unindex(previous);
        }
        // LinkedHashMap keeps the original insertion position on replace
        markers.put(marker.markerId(), marker);
        timeIndex.computeIfAbsent(marker.videoTimestamp(), ts -> new TreeSet<>()).add(marker.markerId());
    }

    private Marker detach(String markerId) {
        Marker removed = markers.remove(markerId);
        if (removed != null) {
            unindex(removed);
        }
        return removed;
    }

    private void unindex(Marker marker) {
        Set<String> ids = timeIndex.get(marker.videoTimestamp());
        if (ids != null) {
            ids.remove(marker.markerId());
            if (ids.isEmpty()) {
                timeIndex.remove(marker.videoTimestamp());
            }
        }
    }

    private void evictOverflow(List<Object> outbound) {
        if (markers.size() <= maxMarkers) {
            return;
        }
        int evicted = 0;
        Iterator<Marker> oldestFirst = markers.values().iterator();
        while (markers.size() > maxMarkers && oldestFirst.hasNext()) {
            Marker m = oldestFirst.next();
            if (m.userCreated()) {
                continue;
            }
            oldestFirst.remove();
            unindex(m);
            outbound.add(new MarkerRemovedEvent(m.markerId(), m.kind(), "evicted", clock.instant()));
            evicted++;
        }
        if (markers.size() > maxMarkers) {
            LOG.warn("Marker count {} exceeds bound {} but remaining markers are user-created", markers.size(), maxMarkers);
        }
        LOG.debug("Evicted {} markers over bound {}", evicted, maxMarkers);
    }

    // --- helpers ---

    private Optional<Marker> removeInternal(String markerId, String reason) {
        Marker removed;
        lock.lock();
        try {
            removed = detach(markerId);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return Optional.empty();
        }
        publisher.publishEvent(new MarkerRemovedEvent(markerId, removed.kind(), reason, clock.instant()));
        return Optional.of(removed);
    }

    private void publishAll(List<Object> events) {
        for (Object event : events) {
            publisher.publishEvent(event);
        }
    }

    static JSONObject toJson(Marker m) {
        JSONObject json = new JSONObject()
                .put("id", m.markerId())
                .put("kind", m.kind().name())
                .put("video_timestamp", m.videoTimestamp())
                .put("label", m.label())
                .put("description", m.description())
                .put("color", m.color().toHex())
                .put("height_scale", m.heightScale())
                .put("priority", m.priority())
                .put("animated", m.animated())
                .put("user_created", m.userCreated());
        if (m.sourceEventId() != null) {
            json.put("source_event_id", m.sourceEventId());
        }
        return json;
    }

    static Marker fromJson(JSONObject json) {
        String id = json.getString("id");
        MarkerKind kind = MarkerKind.fromName(json.optString("kind", ""))
                .orElseThrow(() -> new IllegalArgumentException("Unknown marker kind for " + id));
        return new Marker(
                id,
                json.optString("source_event_id", null),
                kind,
                json.optLong("video_timestamp", 0L),
                json.optString("label", ""),
                json.optString("description", ""),
                MarkerColor.fromHex(json.optString("color", "#808080FF")),
                json.optDouble("height_scale", 0.5),
                json.optInt("priority", 5),
                json.optBoolean("animated", false),
                json.optBoolean("user_created", false));
    }
}
