package com.analyzemyteam.timelinesync.service.metrics;

import com.analyzemyteam.timelinesync.domain.ConnectionState;
import com.analyzemyteam.timelinesync.domain.EventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for the synchronization engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Ingested and dropped events per kind and source</li>
 *   <li>Remote fetch latency and outcome</li>
 *   <li>Connection state transitions</li>
 *   <li>Sync tick duration and queue depth</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SyncMetrics {

    private static final String METRIC_PREFIX = "timelinesync";

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param kind   event kind
     * @param source {@code push}, {@code fetch}, {@code store} or {@code manual}
     */
    public void incrementIngested(EventKind kind, String source) {
        Counter.builder(METRIC_PREFIX + ".events.ingested")
                .description("Events applied to the cache")
                .tag("kind", kind.wireName())
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param reason {@code queue_full}, {@code invalid}, {@code displaced}
     */
    public void incrementDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".events.dropped")
                .description("Events dropped before reaching the cache")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome {@code success}, {@code failure}, {@code timeout}
     */
    public void recordFetch(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".fetch.latency")
                .description("Remote fetch round-trip time")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordConnectionTransition(ConnectionState to) {
        Counter.builder(METRIC_PREFIX + ".connection.transitions")
                .description("Remote connection state transitions")
                .tag("state", to.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordTick(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".tick.duration")
                .description("Time spent in one sync tick")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Registers a gauge reporting the current queue depth. */
    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(METRIC_PREFIX + ".queue.depth", depth)
                .description("Pending items in the sync queue")
                .register(registry);
    }
}
