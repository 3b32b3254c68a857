package com.analyzemyteam.timelinesync.service.store;

import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.exception.EventStoreException;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import com.analyzemyteam.timelinesync.persistence.CoachingAlertEventEntity;
import com.analyzemyteam.timelinesync.persistence.CoachingAlertEventRepository;
import com.analyzemyteam.timelinesync.persistence.FormationEventEntity;
import com.analyzemyteam.timelinesync.persistence.FormationEventRepository;
import com.analyzemyteam.timelinesync.persistence.MelScoreEventEntity;
import com.analyzemyteam.timelinesync.persistence.MelScoreEventRepository;
import com.analyzemyteam.timelinesync.persistence.StoredEventEntity;
import com.analyzemyteam.timelinesync.persistence.StoredEventRepository;
import com.analyzemyteam.timelinesync.persistence.TriangleCallEventEntity;
import com.analyzemyteam.timelinesync.persistence.TriangleCallEventRepository;
import com.analyzemyteam.timelinesync.service.codec.EventJsonCodec;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import com.analyzemyteam.timelinesync.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * {@link EventStore} backed by one Spring Data JPA repository per event kind.
 *
 * <p>Writes that fail are remembered in a bounded pending set and replayed after the next
 * successful write, so a transient database outage does not lose events that are still cached.
 */
@Component
public class JpaEventStore implements EventStore {

    private static final Logger LOG = LogManager.getLogger(JpaEventStore.class);

    static final int MAX_PENDING_WRITES = 1_000;

    private final Map<EventKind, Table<?>> tables = new EnumMap<>(EventKind.class);
    private final TransactionTemplate transactions;
    private final Executor persistenceExecutor;
    private final SyncStatisticsTracker statistics;
    private final Clock clock;

    // guarded by itself; insertion order is replay order
    private final Map<String, SyncEvent> pendingWrites = new LinkedHashMap<>();

    public JpaEventStore(FormationEventRepository formations,
                         TriangleCallEventRepository triangleCalls,
                         CoachingAlertEventRepository coachingAlerts,
                         MelScoreEventRepository melScores,
                         PlatformTransactionManager transactionManager,
                         @Qualifier("persistenceExecutor") Executor persistenceExecutor,
                         SyncStatisticsTracker statistics,
                         Clock clock) {
        tables.put(EventKind.FORMATION, new Table<>(formations, FormationEventEntity::new));
        tables.put(EventKind.TRIANGLE_CALL, new Table<>(triangleCalls, TriangleCallEventEntity::new));
        tables.put(EventKind.COACHING_ALERT, new Table<>(coachingAlerts, CoachingAlertEventEntity::new));
        tables.put(EventKind.MEL_SCORE, new Table<>(melScores, MelScoreEventEntity::new));
        this.transactions = new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
        this.persistenceExecutor = Objects.requireNonNull(persistenceExecutor, "persistenceExecutor");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<SyncEvent> load(int maxEvents) {
        if (maxEvents <= 0) {
            return List.of();
        }
        List<SyncEvent> events = new ArrayList<>();
        int skipped = 0;
        try {
            for (Map.Entry<EventKind, Table<?>> entry : tables.entrySet()) {
                for (StoredEventEntity row : entry.getValue().repository().findLatest(PageRequest.of(0, maxEvents))) {
                    try {
                        events.add(toEvent(entry.getKey(), row));
                    } catch (InvalidEventException ex) {
                        skipped++;
                        LOG.warn("Skipping unreadable {} row id={}: {}", entry.getKey(), row.getId(), ex.getReason());
                    }
                }
            }
        } catch (DataAccessException ex) {
            throw new EventStoreException("load", ex.getMostSpecificCause().getMessage(), ex);
        }
        events.sort(Comparator.comparingLong(SyncEvent::videoTimestamp).reversed());
        List<SyncEvent> result = events.size() > maxEvents ? new ArrayList<>(events.subList(0, maxEvents)) : events;
        LOG.info("Loaded {} events from local store (skipped={})", result.size(), skipped);
        return result;
    }

    @Override
    public void save(SyncEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            write(event);
        } catch (EventStoreException ex) {
            statistics.recordPersistenceFailure();
            remember(event);
            LOG.warn("{} (pending={})", ex.getMessage(), pendingCount());
            return;
        }
        forget(event);
        replayPending();
    }

    @Override
    public void saveAsync(SyncEvent event) {
        persistenceExecutor.execute(() -> save(event));
    }

    @Override
    public int cleanup(int retentionHours) {
        long cutoff = clock.millis() - retentionHours * TimeUtils.MILLIS_PER_HOUR;
        int deleted = 0;
        try {
            for (Map.Entry<EventKind, Table<?>> entry : tables.entrySet()) {
                Integer rows = transactions.execute(status -> entry.getValue().repository().deleteIngestedBefore(cutoff));
                deleted += rows == null ? 0 : rows;
            }
        } catch (DataAccessException ex) {
            statistics.recordPersistenceFailure();
            LOG.warn("Event store cleanup failed: {}", ex.getMostSpecificCause().getMessage());
            return deleted;
        }
        if (deleted > 0) {
            LOG.info("Event store cleanup removed {} rows older than {}h", deleted, retentionHours);
        }
        return deleted;
    }

    @Override
    public void delete(EventKind kind, String id) {
        try {
            transactions.executeWithoutResult(status -> {
                StoredEventRepository<?> repository = tables.get(kind).repository();
                if (repository.findById(id).isPresent()) {
                    repository.deleteById(id);
                }
            });
        } catch (DataAccessException ex) {
            statistics.recordPersistenceFailure();
            LOG.warn("Failed to delete {} id={}: {}", kind, id, ex.getMostSpecificCause().getMessage());
        }
        synchronized (pendingWrites) {
            pendingWrites.remove(pendingKey(kind, id));
        }
    }

    /** Visible for tests */
    int pendingCount() {
        synchronized (pendingWrites) {
            return pendingWrites.size();
        }
    }

    private void write(SyncEvent event) {
        String payload = EventJsonCodec.encodePayload(event.payload()).toString();
        try {
            tables.get(event.kind()).save(event, payload);
        } catch (DataAccessException ex) {
            throw new EventStoreException("save", event.kind() + " id=" + event.id() + ": "
                    + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private void replayPending() {
        List<SyncEvent> replay;
        synchronized (pendingWrites) {
            if (pendingWrites.isEmpty()) {
                return;
            }
            replay = new ArrayList<>(pendingWrites.values());
        }
        int replayed = 0;
        for (SyncEvent event : replay) {
            try {
                write(event);
            } catch (EventStoreException ex) {
                LOG.debug("Pending write replay stopped: {}", ex.getMessage());
                break;
            }
            forget(event);
            replayed++;
        }
        LOG.info("Replayed {} pending event writes", replayed);
    }

    private void remember(SyncEvent event) {
        synchronized (pendingWrites) {
            pendingWrites.remove(pendingKey(event.kind(), event.id()));
            pendingWrites.put(pendingKey(event.kind(), event.id()), event);
            Iterator<String> oldest = pendingWrites.keySet().iterator();
            while (pendingWrites.size() > MAX_PENDING_WRITES && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
    }

    private void forget(SyncEvent event) {
        synchronized (pendingWrites) {
            SyncEvent pending = pendingWrites.get(pendingKey(event.kind(), event.id()));
            // a newer version may have been queued while this write was in flight
            if (pending != null && pending.ingestTimestamp() <= event.ingestTimestamp()) {
                pendingWrites.remove(pendingKey(event.kind(), event.id()));
            }
        }
    }

    private static String pendingKey(EventKind kind, String id) {
        return kind.name() + '/' + id;
    }

    private static SyncEvent toEvent(EventKind kind, StoredEventEntity row) {
        JSONObject payload;
        try {
            payload = new JSONObject(row.getPayload());
        } catch (JSONException ex) {
            throw new InvalidEventException(row.getId(), "payload is not JSON");
        }
        return new SyncEvent(row.getId(), kind, row.getVideoTimestamp(), row.getIngestTimestamp(),
                row.getConfidence(), EventJsonCodec.decodePayload(kind, payload), row.isUserCreated());
    }

    @FunctionalInterface
    private interface EntityFactory<T extends StoredEventEntity> {
        T create(String id, long videoTimestamp, long ingestTimestamp, double confidence,
                 boolean userCreated, String payload);
    }

    private record Table<T extends StoredEventEntity>(StoredEventRepository<T> repository, EntityFactory<T> factory) {

        void save(SyncEvent event, String payload) {
            repository.save(factory.create(event.id(), event.videoTimestamp(), event.ingestTimestamp(),
                    event.confidence(), event.userCreated(), payload));
        }
    }
}
