package com.analyzemyteam.timelinesync.service.coordinator;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallPayload;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;
import com.analyzemyteam.timelinesync.exception.EventStoreException;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import com.analyzemyteam.timelinesync.service.cache.EventCache;
import com.analyzemyteam.timelinesync.service.cache.EventInterpolator;
import com.analyzemyteam.timelinesync.service.cache.UpsertResult;
import com.analyzemyteam.timelinesync.service.coordinator.event.AnimatedMarkersChangedEvent;
import com.analyzemyteam.timelinesync.service.coordinator.event.EventDroppedEvent;
import com.analyzemyteam.timelinesync.service.coordinator.event.StatisticsUpdatedEvent;
import com.analyzemyteam.timelinesync.service.coordinator.event.TriangleCallChangedEvent;
import com.analyzemyteam.timelinesync.service.marker.MarkerManager;
import com.analyzemyteam.timelinesync.service.metrics.SyncMetrics;
import com.analyzemyteam.timelinesync.service.remote.PushMessage;
import com.analyzemyteam.timelinesync.service.remote.RemoteEventListener;
import com.analyzemyteam.timelinesync.service.remote.RemoteSyncClient;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import com.analyzemyteam.timelinesync.service.store.EventStore;
import com.analyzemyteam.timelinesync.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives synchronization between the video playhead and the event timeline.
 *
 * <p>Producers (push channel, fetch results, playback callbacks) only enqueue work into a bounded
 * queue. A self-rescheduling tick drains the queue in arrival order, applies each event to the
 * cache, then the markers, then the local store, and tracks the triangle call at the playhead.
 * The tick interval adapts to the playback rate.
 *
 * <p>Manual operations (formation marks, call overrides, alert acknowledgements) are applied
 * synchronously. Event application is serialized by one lock so that read-modify-write updates of
 * MEL scores stay consistent; lock order is coordinator, then cache, then markers.
 */
@Component
public class SyncCoordinator implements PlaybackListener, RemoteEventListener {

    private static final Logger LOG = LogManager.getLogger(SyncCoordinator.class);

    static final String FORMATION_ID_PREFIX = "formation_";
    static final String MEL_ID_PREFIX = "mel_";
    static final String MANUAL_FORMATION_PREFIX = "manual-formation-";
    static final String MANUAL_CALL_PREFIX = "manual-call-";

    static final String SOURCE_PUSH = "push";
    static final String SOURCE_FETCH = "fetch";
    static final String SOURCE_MANUAL = "manual";
    static final String SOURCE_STORE = "store";
    static final String SOURCE_DERIVED = "derived";

    private final EventCache cache;
    private final MarkerManager markers;
    private final EventStore store;
    private final RemoteSyncClient remote;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final SyncStatisticsTracker statistics;
    private final SyncMetrics metrics;
    private final Clock clock;

    private final long baseIntervalMs;
    private final long minTickMs;
    private final long maxTickMs;
    private final int drainPerTick;
    private final int criticalAlertPriority;
    private final long fetchDebounceMs;
    private final long fetchWindowMs;
    private final int maxCachedEvents;
    private final int retentionHours;
    private final long animationWindowMs;

    private final EventQueue<WorkItem> queue;

    /** Serializes event application. */
    private final ReentrantLock applyLock = new ReentrantLock();
    /** Guards lifecycle, fetch debounce and tracking state. */
    private final ReentrantLock stateLock = new ReentrantLock();

    private volatile long position;
    private volatile double rate = 1.0;
    private volatile boolean playing;
    private volatile boolean running;
    /** Set when a position tick could not be queued; the next tick still re-resolves the playhead. */
    private volatile boolean positionPending;

    // guarded by stateLock
    private ScheduledFuture<?> tickTask;
    private long lastFetchWallMs = -1L;
    private TriangleCallType lastCall = TriangleCallType.NO_CALL;
    private List<String> lastAnimated = List.of();

    public SyncCoordinator(EventCache cache,
                           MarkerManager markers,
                           EventStore store,
                           RemoteSyncClient remote,
                           @Qualifier("syncScheduler") TaskScheduler scheduler,
                           ApplicationEventPublisher publisher,
                           SyncStatisticsTracker statistics,
                           SyncMetrics metrics,
                           SyncProperties properties,
                           Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.markers = Objects.requireNonNull(markers, "markers");
        this.store = Objects.requireNonNull(store, "store");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.baseIntervalMs = properties.getSyncIntervalMs();
        this.minTickMs = properties.getMinTickMs();
        this.maxTickMs = properties.getMaxTickMs();
        this.drainPerTick = properties.getQueue().getDrainPerTick();
        this.criticalAlertPriority = properties.getQueue().getCriticalAlertPriority();
        this.fetchDebounceMs = properties.getFetch().getDebounceMs();
        this.fetchWindowMs = properties.getFetch().getWindowMs();
        this.maxCachedEvents = properties.getMaxCachedEvents();
        this.retentionHours = properties.getRetentionHours();
        this.animationWindowMs = properties.getMarkers().getAnimationWindowMs();
        this.queue = new EventQueue<>(properties.getQueue().getCapacity());

        metrics.registerQueueDepth(queue::size);
        remote.setListener(this);
    }

    // --- lifecycle ---

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    /**
     * Loads the local store into the cache, connects the remote client, fetches the window
     * around the playhead and starts the sync tick. Idempotent.
     */
    public void start() {
        stateLock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
        } finally {
            stateLock.unlock();
        }
        int loaded = loadFromStore();
        LOG.info("Sync coordinator started: {} events restored, base interval {} ms", loaded, baseIntervalMs);
        remote.connect();
        requestFetch(position, true);
        scheduleNextTick();
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> task;
        stateLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            task = tickTask;
            tickTask = null;
        } finally {
            stateLock.unlock();
        }
        if (task != null) {
            task.cancel(false);
        }
        remote.disconnect();
        LOG.info("Sync coordinator stopped with {} queued items", queue.size());
    }

    public boolean isRunning() {
        return running;
    }

    // --- playback ---

    @Override
    public void onPlaybackStarted() {
        playing = true;
        LOG.debug("Playback started at {}", position);
        requestFetch(position, false);
    }

    @Override
    public void onPlaybackStopped() {
        playing = false;
        LOG.debug("Playback stopped at {}", position);
    }

    @Override
    public void onPositionChanged(long positionMs) {
        setVideoPosition(positionMs);
    }

    /**
     * Moves the playhead. Lookups happen on the next tick; a window fetch is issued when the
     * debounce interval has passed since the previous fetch.
     */
    public void setVideoPosition(long positionMs) {
        long t = Math.max(0L, positionMs);
        position = t;
        offer(new PositionChanged(t), EventQueue.Priority.LOW);
        requestFetch(t, false);
    }

    /**
     * Jumps the playhead: resolves the active events immediately and fetches around the target
     * regardless of the debounce.
     */
    @Override
    public void onSeek(long positionMs) {
        long t = Math.max(0L, positionMs);
        position = t;
        ThreadContext.put("videoPosition", Long.toString(t));
        try {
            Map<EventKind, SyncEvent> active = eventsAt(t);
            LOG.debug("Seek to {} resolved {} active events", t, active.size());
            trackTriangleCall(active.get(EventKind.FORMATION));
            requestFetch(t, true);
        } finally {
            ThreadContext.remove("videoPosition");
        }
    }

    @Override
    public void onRateChanged(double newRate) {
        rate = (Double.isNaN(newRate) || Double.isInfinite(newRate) || newRate <= 0) ? 1.0 : newRate;
        LOG.debug("Playback rate {} -> tick interval {} ms", rate, currentTickIntervalMs());
    }

    public long currentPosition() {
        return position;
    }

    public boolean isPlaying() {
        return playing;
    }

    public double playbackRate() {
        return rate;
    }

    public long currentTickIntervalMs() {
        return TimeUtils.adaptiveInterval(baseIntervalMs, rate, minTickMs, maxTickMs);
    }

    public int queueDepth() {
        return queue.size();
    }

    // --- lookups ---

    /**
     * Resolves every kind at a position (exact, interpolated or nearest).
     */
    public Map<EventKind, SyncEvent> eventsAt(long positionMs) {
        Map<EventKind, SyncEvent> active = new EnumMap<>(EventKind.class);
        for (EventKind kind : EventKind.values()) {
            cache.at(kind, positionMs).ifPresent(e -> active.put(kind, e));
        }
        return active;
    }

    // --- remote ---

    @Override
    public void onPushMessage(PushMessage message) {
        if (message instanceof PushMessage.EventMessage eventMessage) {
            SyncEvent event = eventMessage.event();
            offer(new Ingest(event, SOURCE_PUSH), priorityOf(event));
        } else if (message instanceof PushMessage.MelStageMessage stage) {
            offer(new MelStageUpdate(stage), EventQueue.Priority.LOW);
        } else if (message instanceof PushMessage.MelScoresMessage scores) {
            offer(new MelScoreUpdate(scores), EventQueue.Priority.LOW);
        }
        // heartbeat acks are consumed by the client
    }

    @Override
    public void onFetchCompleted(long fromMs, long toMs, List<SyncEvent> events) {
        LOG.debug("Fetched {} events for [{}, {}]", events.size(), fromMs, toMs);
        for (SyncEvent event : events) {
            offer(new Ingest(event, SOURCE_FETCH), priorityOf(event));
        }
    }

    // --- manual operations ---

    /**
     * Records a formation observed by the user. The triangle call is derived from the formation.
     *
     * @throws InvalidEventException when the timestamp is negative or the confidence is not a number
     */
    public SyncEvent markFormation(long videoTimestamp, FormationType type, double confidence) {
        FormationPayload payload = new FormationPayload(type, null, null, null, null, null);
        SyncEvent event = SyncEvent.userCreated(MANUAL_FORMATION_PREFIX + videoTimestamp, videoTimestamp,
                clock.millis(), confidence, payload);
        SyncEvent applied = applyNow(event, SOURCE_MANUAL);
        LOG.info("Manual formation {} marked at {} (confidence {})", type, videoTimestamp, confidence);
        return applied;
    }

    /**
     * Records a user override of the triangle call. The formation at the timestamp, if any,
     * carries the new call from now on.
     */
    public SyncEvent overrideTriangleCall(long videoTimestamp, TriangleCallType call, String reason) {
        Objects.requireNonNull(call, "call");
        long now = clock.millis();
        Optional<SyncEvent> formation = cache.at(EventKind.FORMATION, videoTimestamp)
                .filter(e -> !EventInterpolator.isSynthetic(e));
        String formationId = formation.map(SyncEvent::id).orElse("");
        SyncEvent override = SyncEvent.userCreated(MANUAL_CALL_PREFIX + videoTimestamp, videoTimestamp, now,
                SyncEvent.DEFAULT_CONFIDENCE, new TriangleCallPayload(call, formationId, reason));
        SyncEvent applied = applyNow(override, SOURCE_MANUAL);
        formation.ifPresent(f -> {
            FormationPayload payload = f.payloadAs(FormationPayload.class).withRecommendedCall(call);
            applyNow(f.withPayload(payload).withIngestTimestamp(now), SOURCE_MANUAL);
        });
        if (formation.isEmpty()) {
            LOG.warn("No formation at {} for triangle call override; recorded {} only", videoTimestamp, call);
        } else {
            LOG.info("Triangle call at {} overridden to {}: {}", videoTimestamp, call, reason);
        }
        return applied;
    }

    /**
     * Marks a coaching alert acknowledged.
     *
     * @return the updated alert, or empty when no alert has this id
     */
    public Optional<SyncEvent> acknowledgeAlert(String alertId) {
        applyLock.lock();
        try {
            Optional<SyncEvent> alert = cache.findById(EventKind.COACHING_ALERT, alertId);
            if (alert.isEmpty()) {
                return Optional.empty();
            }
            SyncEvent existing = alert.get();
            CoachingAlertPayload payload = existing.payloadAs(CoachingAlertPayload.class);
            if (payload.acknowledged()) {
                return alert;
            }
            SyncEvent updated = existing.withPayload(payload.acknowledge()).withIngestTimestamp(clock.millis());
            apply(updated, SOURCE_MANUAL);
            LOG.info("Coaching alert {} acknowledged", alertId);
            return Optional.of(updated);
        } finally {
            applyLock.unlock();
        }
    }

    public void resetStatistics() {
        statistics.reset();
        LOG.info("Sync statistics reset");
    }

    // --- ticks ---

    /**
     * One sync step: drain up to the per-tick budget, then track the call at the playhead.
     */
    void tick() {
        long startNanos = System.nanoTime();
        statistics.recordSyncOperation();
        List<WorkItem> items = queue.drain(drainPerTick);
        boolean moved = positionPending;
        positionPending = false;
        for (WorkItem item : items) {
            if (item instanceof PositionChanged) {
                moved = true;
            } else {
                process(item);
            }
        }
        if (moved || playing) {
            trackTriangleCall(cache.at(EventKind.FORMATION, position).orElse(null));
        }
        metrics.recordTick(System.nanoTime() - startNanos);
    }

    @Scheduled(fixedRateString = "${sync.timers.statistics-interval-ms:5000}")
    public void publishStatistics() {
        if (!running) {
            return;
        }
        publisher.publishEvent(new StatisticsUpdatedEvent(statistics.snapshot(), queue.size(), clock.instant()));
    }

    /**
     * Applies the retention window to the local store and the cache.
     */
    @Scheduled(fixedRateString = "${sync.timers.cleanup-interval-ms:3600000}",
            initialDelayString = "${sync.timers.cleanup-interval-ms:3600000}")
    public void cleanup() {
        if (!running) {
            return;
        }
        int deletedRows = store.cleanup(retentionHours);
        long cutoff = clock.millis() - retentionHours * TimeUtils.MILLIS_PER_HOUR;
        List<SyncEvent> expired;
        applyLock.lock();
        try {
            expired = cache.evictIngestedBefore(cutoff);
            for (SyncEvent event : expired) {
                markers.onEventRemoved(event.kind(), event.id());
            }
        } finally {
            applyLock.unlock();
        }
        LOG.info("Retention cleanup: {} stored rows, {} cached events removed", deletedRows, expired.size());
    }

    @Scheduled(fixedRateString = "${sync.markers.sweep-interval-ms:300000}",
            initialDelayString = "${sync.markers.sweep-interval-ms:300000}")
    public void sweepMarkers() {
        if (!running) {
            return;
        }
        markers.sweep(position);
    }

    @Scheduled(fixedRateString = "${sync.markers.animation-interval-ms:500}")
    public void refreshAnimatedMarkers() {
        if (!running) {
            return;
        }
        long t = position;
        List<String> animated = markers.animatedMarkersNear(t, animationWindowMs);
        stateLock.lock();
        try {
            if (animated.equals(lastAnimated)) {
                return;
            }
            lastAnimated = List.copyOf(animated);
        } finally {
            stateLock.unlock();
        }
        publisher.publishEvent(new AnimatedMarkersChangedEvent(animated, t, clock.instant()));
    }

    // --- internals ---

    private void scheduleNextTick() {
        stateLock.lock();
        try {
            if (!running) {
                return;
            }
            tickTask = scheduler.schedule(this::runTick, clock.instant().plusMillis(currentTickIntervalMs()));
        } finally {
            stateLock.unlock();
        }
    }

    private void runTick() {
        try {
            tick();
        } catch (RuntimeException ex) {
            LOG.error("Sync tick failed; continuing with next tick", ex);
        } finally {
            scheduleNextTick();
        }
    }

    private int loadFromStore() {
        List<SyncEvent> stored;
        try {
            stored = store.load(maxCachedEvents);
        } catch (EventStoreException ex) {
            LOG.warn("Local event store unavailable, starting with an empty cache: {}", ex.getMessage());
            return 0;
        }
        int applied = 0;
        applyLock.lock();
        try {
            for (SyncEvent event : stored) {
                UpsertResult result = cache.upsert(event);
                if (result.changed()) {
                    refreshMarkers(event, result);
                    metrics.incrementIngested(event.kind(), SOURCE_STORE);
                    applied++;
                }
            }
        } finally {
            applyLock.unlock();
        }
        return applied;
    }

    private void requestFetch(long around, boolean bypassDebounce) {
        if (!remote.isEnabled()) {
            return;
        }
        long now = clock.millis();
        stateLock.lock();
        try {
            if (!bypassDebounce && lastFetchWallMs >= 0 && now - lastFetchWallMs <= fetchDebounceMs) {
                return;
            }
            lastFetchWallMs = now;
        } finally {
            stateLock.unlock();
        }
        remote.fetchRange(TimeUtils.floorAtZero(around, fetchWindowMs), around + fetchWindowMs);
    }

    private EventQueue.Priority priorityOf(SyncEvent event) {
        if (event.kind() == EventKind.COACHING_ALERT
                && event.payloadAs(CoachingAlertPayload.class).priorityLevel() >= criticalAlertPriority) {
            return EventQueue.Priority.HIGH;
        }
        return EventQueue.Priority.LOW;
    }

    private void offer(WorkItem item, EventQueue.Priority priority) {
        EventQueue.Offer<WorkItem> offer = queue.offer(item, priority);
        WorkItem lost;
        String detail;
        switch (offer.result()) {
            case ACCEPTED:
                return;
            case DISPLACED:
                lost = offer.displaced().orElseThrow();
                detail = "displaced by critical " + item.eventId();
                break;
            default:
                lost = item;
                detail = "queue full at " + queue.capacity();
        }
        if (lost instanceof PositionChanged) {
            // the playhead field already holds the latest position
            positionPending = true;
            LOG.trace("Position tick not queued: {}", detail);
            return;
        }
        statistics.recordDropped();
        metrics.incrementDropped("queue_full");
        publisher.publishEvent(new EventDroppedEvent(lost.eventId(), "queue_full", detail, clock.instant()));
    }

    private void process(WorkItem item) {
        try {
            if (item instanceof Ingest ingest) {
                applyNow(ingest.event(), ingest.source());
            } else if (item instanceof MelStageUpdate stage) {
                applyMelStage(stage.message());
            } else if (item instanceof MelScoreUpdate scores) {
                applyMelScores(scores.message());
            }
        } catch (InvalidEventException ex) {
            statistics.recordDropped();
            metrics.incrementDropped("invalid");
            publisher.publishEvent(new EventDroppedEvent(ex.getEventId(), "invalid", ex.getReason(), clock.instant()));
        }
    }

    private SyncEvent applyNow(SyncEvent event, String source) {
        applyLock.lock();
        try {
            return apply(event, source);
        } finally {
            applyLock.unlock();
        }
    }

    /**
     * Cache, then markers, then store. Caller holds {@link #applyLock}.
     */
    private SyncEvent apply(SyncEvent incoming, String source) {
        SyncEvent event = withDerivedCall(incoming);
        UpsertResult result = cache.upsert(event);
        if (!result.changed()) {
            LOG.trace("Upsert of {} {} was {}", event.kind(), event.id(), result);
            return event;
        }
        statistics.recordEventProcessed();
        metrics.incrementIngested(event.kind(), source);
        if (SOURCE_PUSH.equals(source) || SOURCE_FETCH.equals(source)) {
            statistics.recordLatency(Math.max(0L, clock.millis() - event.ingestTimestamp()));
        }
        refreshMarkers(event, result);
        store.saveAsync(event);

        if (event.kind() == EventKind.FORMATION
                && cache.findById(EventKind.COACHING_ALERT, TriangleCallRules.URGENCY_ID_PREFIX + event.id()).isEmpty()) {
            // raised once per formation so an acknowledged alert stays acknowledged
            TriangleCallRules.urgencyAlert(event, clock.millis())
                    .ifPresent(alert -> apply(alert, SOURCE_DERIVED));
        }
        return event;
    }

    /**
     * Creates or updates the marker of an upserted event and drops the markers of events the
     * cache evicted to make room for it.
     */
    private void refreshMarkers(SyncEvent event, UpsertResult result) {
        boolean selfEvicted = false;
        for (SyncEvent evicted : result.evicted()) {
            markers.onEventRemoved(evicted.kind(), evicted.id());
            selfEvicted |= evicted.kind() == event.kind() && evicted.id().equals(event.id());
        }
        if (!selfEvicted) {
            markers.onEventUpserted(event);
        }
    }

    private static SyncEvent withDerivedCall(SyncEvent event) {
        if (event.kind() != EventKind.FORMATION) {
            return event;
        }
        FormationPayload payload = event.payloadAs(FormationPayload.class);
        if (payload.recommendedCall() != TriangleCallType.NO_CALL) {
            return event;
        }
        TriangleCallType derived = TriangleCallRules.determineCall(payload);
        return derived == TriangleCallType.NO_CALL ? event : event.withPayload(payload.withRecommendedCall(derived));
    }

    private void applyMelStage(PushMessage.MelStageMessage message) {
        if (!message.completed()) {
            LOG.debug("MEL stage {} for {} is {}", message.stage(), message.formationId(), message.status());
            return;
        }
        applyLock.lock();
        try {
            String melId = MEL_ID_PREFIX + message.formationId();
            Optional<SyncEvent> existing = cache.findById(EventKind.MEL_SCORE, melId);
            Optional<SyncEvent> formation = findFormation(message.formationId());
            OptionalLong at = placement(existing, formation, -1L);
            if (at.isEmpty()) {
                LOG.debug("Dropping MEL stage for unknown formation {}", message.formationId());
                return;
            }
            MelScorePayload current = existing
                    .map(e -> e.payloadAs(MelScorePayload.class))
                    .orElseGet(() -> MelScorePayload.empty(message.formationId()));
            MelScorePayload updated = current.withStage(message.stage(), message.score(), message.status());
            if (updated == current) {
                LOG.debug("Ignoring unknown MEL stage {}", message.stage());
                return;
            }
            applyMel(melId, at.getAsLong(), updated, formation);
        } finally {
            applyLock.unlock();
        }
    }

    private void applyMelScores(PushMessage.MelScoresMessage message) {
        applyLock.lock();
        try {
            String melId = MEL_ID_PREFIX + message.formationId();
            Optional<SyncEvent> existing = cache.findById(EventKind.MEL_SCORE, melId);
            Optional<SyncEvent> formation = findFormation(message.formationId());
            OptionalLong at = placement(existing, formation, message.videoTimestamp());
            if (at.isEmpty()) {
                LOG.debug("Dropping MEL scores without a timeline position for {}", message.formationId());
                return;
            }
            applyMel(melId, at.getAsLong(), message.scores(), formation);
        } finally {
            applyLock.unlock();
        }
    }

    private void applyMel(String melId, long videoTimestamp, MelScorePayload scores, Optional<SyncEvent> formation) {
        long now = clock.millis();
        apply(SyncEvent.of(melId, videoTimestamp, now, SyncEvent.DEFAULT_CONFIDENCE, scores), SOURCE_PUSH);
        formation.ifPresent(f -> {
            FormationPayload payload = f.payloadAs(FormationPayload.class).withMelScores(scores.scores());
            apply(f.withPayload(payload).withIngestTimestamp(now), SOURCE_DERIVED);
        });
    }

    private Optional<SyncEvent> findFormation(String formationId) {
        Optional<SyncEvent> prefixed = cache.findById(EventKind.FORMATION, FORMATION_ID_PREFIX + formationId);
        return prefixed.isPresent() ? prefixed : cache.findById(EventKind.FORMATION, formationId);
    }

    /** Explicit position first, then the existing score event, then the formation. */
    private static OptionalLong placement(Optional<SyncEvent> existing, Optional<SyncEvent> formation, long explicit) {
        if (explicit >= 0) {
            return OptionalLong.of(explicit);
        }
        if (existing.isPresent()) {
            return OptionalLong.of(existing.get().videoTimestamp());
        }
        return formation.map(f -> OptionalLong.of(f.videoTimestamp())).orElse(OptionalLong.empty());
    }

    private void trackTriangleCall(SyncEvent formation) {
        if (formation == null) {
            return;
        }
        TriangleCallType current = formation.payloadAs(FormationPayload.class).recommendedCall();
        TriangleCallType previous;
        stateLock.lock();
        try {
            if (current == lastCall) {
                return;
            }
            previous = lastCall;
            lastCall = current;
        } finally {
            stateLock.unlock();
        }
        LOG.debug("Triangle call at {} changed {} -> {}", formation.videoTimestamp(), previous, current);
        publisher.publishEvent(new TriangleCallChangedEvent(previous, current, formation.id(),
                formation.videoTimestamp(), clock.instant()));
    }

    // --- queued work ---

    private interface WorkItem {

        /** Id of the event this item would create or update, empty for playhead moves. */
        String eventId();
    }

    private record Ingest(SyncEvent event, String source) implements WorkItem {

        @Override
        public String eventId() {
            return event.id();
        }
    }

    private record MelStageUpdate(PushMessage.MelStageMessage message) implements WorkItem {

        @Override
        public String eventId() {
            return MEL_ID_PREFIX + message.formationId();
        }
    }

    private record MelScoreUpdate(PushMessage.MelScoresMessage message) implements WorkItem {

        @Override
        public String eventId() {
            return MEL_ID_PREFIX + message.formationId();
        }
    }

    private record PositionChanged(long position) implements WorkItem {

        @Override
        public String eventId() {
            return "";
        }
    }
}
