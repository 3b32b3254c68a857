package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import com.analyzemyteam.timelinesync.domain.ConnectionState;
import com.analyzemyteam.timelinesync.domain.ConnectionStatus;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import com.analyzemyteam.timelinesync.exception.RemoteSyncException;
import com.analyzemyteam.timelinesync.service.metrics.SyncMetrics;
import com.analyzemyteam.timelinesync.service.remote.event.ConnectionStateChangedEvent;
import com.analyzemyteam.timelinesync.service.remote.event.RemoteFetchFailedEvent;
import com.analyzemyteam.timelinesync.service.remote.event.RemoteMessageDroppedEvent;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import com.analyzemyteam.timelinesync.util.LogSanitizer;
import com.analyzemyteam.timelinesync.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connection manager for the analytics backend: REST window fetches plus a push channel with
 * heartbeat and bounded reconnect.
 *
 * <p>State machine:
 * <pre>
 * DISCONNECTED --connect--> CONNECTING --open--> CONNECTED
 * CONNECTED --heartbeat timeout / transport error--> DISCONNECTED --backoff--> CONNECTING
 * (reconnect budget exhausted) --> DEGRADED --reconnect()--> CONNECTING
 * </pre>
 *
 * <p>All network failures stop here: they become state transitions, retries and
 * telemetry events, never exceptions thrown at the listener. No lock is held while
 * calling into the transport or the listener.
 */
@Component
public class RemoteSyncClient {

    private static final Logger LOG = LogManager.getLogger(RemoteSyncClient.class);

    private static final int LOG_PREVIEW_CHARS = 120;
    private static final String FETCH_TIMEOUT = "fetch_timeout";
    static final List<String> CHANNELS = List.of("formations", "coaching_alerts", "mel_pipeline");

    private final RemoteEventApi api;
    private final PushChannel channel;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final SyncStatisticsTracker statistics;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final RemotePushMessageParser parser;

    private final boolean enabled;
    private final String clientId;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final Duration reconnectBackoff;
    private final int maxReconnectAttempts;
    private final long fetchTimeoutMs;
    private final int fetchMaxRetries;
    private final long fetchRetryBackoffMs;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int reconnectAttempts;
    private Instant lastHeartbeatAck;
    private long connectionGeneration;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> heartbeatTimeoutTask;
    private ScheduledFuture<?> reconnectTask;
    private long fetchGeneration;
    private CompletableFuture<List<SyncEvent>> inFlightFetch;
    private ScheduledFuture<?> fetchRetryTask;

    private volatile RemoteEventListener listener;

    public RemoteSyncClient(RemoteEventApi api,
                            PushChannel channel,
                            @Qualifier("syncScheduler") TaskScheduler scheduler,
                            ApplicationEventPublisher publisher,
                            SyncStatisticsTracker statistics,
                            SyncMetrics metrics,
                            SyncProperties properties,
                            Clock clock) {
        this.api = Objects.requireNonNull(api, "api");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.parser = new RemotePushMessageParser(clock);

        SyncProperties.Remote remote = properties.getRemote();
        this.enabled = remote.isEnabled();
        this.clientId = remote.getClientId();
        this.heartbeatInterval = Duration.ofMillis(remote.getHeartbeatIntervalMs());
        this.heartbeatTimeout = Duration.ofMillis(remote.getHeartbeatTimeoutMs());
        this.reconnectBackoff = Duration.ofMillis(properties.getReconnectBackoffMs());
        this.maxReconnectAttempts = properties.getMaxReconnectAttempts();
        this.fetchTimeoutMs = properties.getFetch().getTimeoutMs();
        this.fetchMaxRetries = properties.getFetch().getMaxRetries();
        this.fetchRetryBackoffMs = properties.getFetch().getRetryBackoffMs();
    }

    public void setListener(RemoteEventListener listener) {
        this.listener = listener;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public ConnectionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public ConnectionStatus status() {
        lock.lock();
        try {
            return new ConnectionStatus(state, reconnectAttempts, lastHeartbeatAck);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the push channel unless already connected or connecting. A DEGRADED client stays
     * degraded; use {@link #reconnect()}.
     */
    public void connect() {
        if (!enabled) {
            LOG.info("Remote sync disabled; running from local store only");
            return;
        }
        long generation;
        ConnectionStateChangedEvent change;
        lock.lock();
        try {
            if (state != ConnectionState.DISCONNECTED) {
                return;
            }
            cancel(reconnectTask);
            reconnectTask = null;
            generation = ++connectionGeneration;
            change = transition(ConnectionState.CONNECTING, "connect");
        } finally {
            lock.unlock();
        }
        publish(change);
        openChannel(generation);
    }

    /**
     * Explicit reconnect: resets the attempt budget and connects from any state.
     */
    public void reconnect() {
        if (!enabled) {
            return;
        }
        long generation;
        ConnectionStateChangedEvent change;
        lock.lock();
        try {
            cancelConnectionTimers();
            reconnectAttempts = 0;
            generation = ++connectionGeneration;
            change = transition(ConnectionState.CONNECTING, "manual_reconnect");
        } finally {
            lock.unlock();
        }
        channel.close();
        publish(change);
        openChannel(generation);
    }

    /**
     * Closes the push channel, cancels every timer and the in-flight fetch.
     */
    @PreDestroy
    public void disconnect() {
        ConnectionStateChangedEvent change;
        CompletableFuture<List<SyncEvent>> fetch;
        lock.lock();
        try {
            connectionGeneration++;
            fetchGeneration++;
            cancelConnectionTimers();
            cancel(fetchRetryTask);
            fetchRetryTask = null;
            fetch = inFlightFetch;
            inFlightFetch = null;
            change = transition(ConnectionState.DISCONNECTED, "client_stop");
        } finally {
            lock.unlock();
        }
        if (fetch != null) {
            fetch.cancel(true);
        }
        channel.close();
        publish(change);
    }

    /**
     * Requests all events in {@code [fromMs, toMs]}. Supersedes and cancels any fetch still in flight.
     * Results are delivered to {@link RemoteEventListener#onFetchCompleted}.
     */
    public void fetchRange(long fromMs, long toMs) {
        if (!enabled) {
            return;
        }
        long from = Math.max(0L, fromMs);
        long to = Math.max(from, toMs);
        long generation;
        CompletableFuture<List<SyncEvent>> superseded;
        lock.lock();
        try {
            generation = ++fetchGeneration;
            superseded = inFlightFetch;
            inFlightFetch = null;
            cancel(fetchRetryTask);
            fetchRetryTask = null;
        } finally {
            lock.unlock();
        }
        if (superseded != null && superseded.cancel(true)) {
            LOG.debug("Cancelled superseded fetch");
        }
        startFetchAttempt(generation, from, to, 0);
    }

    // --- push channel ---

    private void openChannel(long generation) {
        try {
            channel.open(new ChannelCallbacks(generation));
        } catch (RuntimeException ex) {
            onTransportFailure(generation, "open_failed", ex);
        }
    }

    private void onChannelOpen(long generation) {
        ConnectionStateChangedEvent change;
        lock.lock();
        try {
            if (generation != connectionGeneration || state != ConnectionState.CONNECTING) {
                return;
            }
            reconnectAttempts = 0;
            lastHeartbeatAck = clock.instant();
            cancel(reconnectTask);
            reconnectTask = null;
            heartbeatTask = scheduler.scheduleAtFixedRate(() -> sendHeartbeat(generation),
                    clock.instant().plus(heartbeatInterval), heartbeatInterval);
            rescheduleHeartbeatTimeout(generation);
            change = transition(ConnectionState.CONNECTED, "connected");
        } finally {
            lock.unlock();
        }
        publish(change);
        channel.send(subscribeMessage());
        LOG.info("Push channel connected (client_id={})", clientId);
    }

    private void onChannelMessage(long generation, String text) {
        if (!isCurrent(generation)) {
            return;
        }
        Optional<PushMessage> parsed;
        try {
            parsed = parser.parse(text);
        } catch (InvalidEventException ex) {
            String type = RemotePushMessageParser.peekType(text);
            LOG.warn("Dropping malformed push message type={}: {} (text={})",
                    type, ex.getReason(), LogSanitizer.preview(text, LOG_PREVIEW_CHARS));
            metrics.incrementDropped("invalid");
            publisher.publishEvent(new RemoteMessageDroppedEvent(type, ex.getReason(), clock.instant()));
            return;
        }
        if (parsed.isEmpty()) {
            LOG.debug("Ignoring push message of unknown type: {}", LogSanitizer.preview(text, LOG_PREVIEW_CHARS));
            return;
        }
        PushMessage message = parsed.get();
        if (message instanceof PushMessage.HeartbeatAck) {
            onHeartbeatAck(generation);
            return;
        }
        RemoteEventListener l = listener;
        if (l != null) {
            l.onPushMessage(message);
        }
    }

    private void onHeartbeatAck(long generation) {
        lock.lock();
        try {
            if (generation != connectionGeneration || state != ConnectionState.CONNECTED) {
                return;
            }
            lastHeartbeatAck = clock.instant();
            rescheduleHeartbeatTimeout(generation);
        } finally {
            lock.unlock();
        }
    }

    private void sendHeartbeat(long generation) {
        if (!isCurrent(generation)) {
            return;
        }
        JSONObject heartbeat = new JSONObject()
                .put("event", "heartbeat")
                .put("timestamp", clock.millis())
                .put("client_id", clientId);
        if (!channel.send(heartbeat.toString())) {
            onTransportFailure(generation, "heartbeat_send_failed", null);
        }
    }

    private void onHeartbeatTimeout(long generation) {
        LOG.warn("No heartbeat acknowledgment within {} ms", heartbeatTimeout.toMillis());
        onTransportFailure(generation, "heartbeat_timeout", null);
    }

    /**
     * Drops the connection and schedules a reconnect, or degrades when the budget is spent.
     */
    private void onTransportFailure(long generation, String reason, Throwable error) {
        ConnectionStateChangedEvent disconnected;
        ConnectionStateChangedEvent degraded = null;
        lock.lock();
        try {
            if (generation != connectionGeneration
                    || state == ConnectionState.DISCONNECTED
                    || state == ConnectionState.DEGRADED) {
                return;
            }
            connectionGeneration++;
            cancelConnectionTimers();
            disconnected = transition(ConnectionState.DISCONNECTED, reason);
            if (reconnectAttempts >= maxReconnectAttempts) {
                degraded = transition(ConnectionState.DEGRADED, "reconnect_budget_exhausted");
            } else {
                reconnectTask = scheduler.schedule(this::attemptReconnect, clock.instant().plus(reconnectBackoff));
            }
        } finally {
            lock.unlock();
        }
        channel.close();
        if (error != null) {
            LOG.warn("Push channel failure ({}): {}", reason, error.toString());
        } else {
            LOG.warn("Push channel lost: {}", reason);
        }
        publish(disconnected);
        if (degraded != null) {
            LOG.error("Giving up after {} reconnect attempts; remote sync DEGRADED until manual reconnect",
                    maxReconnectAttempts);
            publish(degraded);
        }
    }

    private void attemptReconnect() {
        long generation;
        ConnectionStateChangedEvent change;
        lock.lock();
        try {
            reconnectTask = null;
            if (state != ConnectionState.DISCONNECTED) {
                return;
            }
            reconnectAttempts++;
            generation = ++connectionGeneration;
            change = transition(ConnectionState.CONNECTING, "reconnect_attempt_" + reconnectAttempts);
        } finally {
            lock.unlock();
        }
        LOG.info("Reconnect attempt {}/{}", change.reconnectAttempts(), maxReconnectAttempts);
        publish(change);
        openChannel(generation);
    }

    private String subscribeMessage() {
        return new JSONObject()
                .put("event", "subscribe")
                .put("client_id", clientId)
                .put("channels", new JSONArray(CHANNELS))
                .put("timestamp", clock.millis())
                .toString();
    }

    // --- fetch ---

    private void startFetchAttempt(long generation, long from, long to, int attempt) {
        lock.lock();
        try {
            if (generation != fetchGeneration) {
                return;
            }
            fetchRetryTask = null;
        } finally {
            lock.unlock();
        }
        statistics.recordNetworkRequest();
        long startNanos = System.nanoTime();
        CompletableFuture<List<SyncEvent>> future = api.fetchRange(from, to);
        boolean superseded;
        lock.lock();
        try {
            superseded = generation != fetchGeneration;
            if (!superseded) {
                inFlightFetch = future;
            }
        } finally {
            lock.unlock();
        }
        if (superseded) {
            future.cancel(true);
            return;
        }
        ScheduledFuture<?> timeout = scheduler.schedule(
                () -> future.completeExceptionally(
                        new RemoteSyncException(FETCH_TIMEOUT, "no response within " + fetchTimeoutMs + " ms")),
                clock.instant().plusMillis(fetchTimeoutMs));
        future.whenComplete((events, error) -> {
            timeout.cancel(false);
            onFetchFinished(generation, from, to, attempt, startNanos, future, events, error);
        });
    }

    private void onFetchFinished(long generation, long from, long to, int attempt, long startNanos,
                                 CompletableFuture<List<SyncEvent>> future, List<SyncEvent> events, Throwable error) {
        long duration = System.nanoTime() - startNanos;
        boolean current;
        lock.lock();
        try {
            current = generation == fetchGeneration;
            if (current && inFlightFetch == future) {
                inFlightFetch = null;
            }
        } finally {
            lock.unlock();
        }
        if (future.isCancelled() || !current) {
            return;
        }

        if (error == null) {
            metrics.recordFetch("success", duration);
            statistics.recordLatency(TimeUtils.nanosToMillis(duration));
            LOG.debug("Fetched {} events for [{}, {}]", events.size(), from, to);
            RemoteEventListener l = listener;
            if (l != null) {
                l.onFetchCompleted(from, to, events);
            }
            return;
        }

        Throwable cause = unwrap(error);
        boolean timedOut = cause instanceof RemoteSyncException rse && FETCH_TIMEOUT.equals(rse.getOperation());
        metrics.recordFetch(timedOut ? "timeout" : "failure", duration);
        int nextAttempt = attempt + 1;
        if (nextAttempt <= fetchMaxRetries) {
            long delay = fetchRetryBackoffMs * nextAttempt;
            LOG.warn("Fetch [{}, {}] failed ({}); retry {}/{} in {} ms",
                    from, to, cause.getMessage(), nextAttempt, fetchMaxRetries, delay);
            lock.lock();
            try {
                if (generation == fetchGeneration) {
                    fetchRetryTask = scheduler.schedule(() -> startFetchAttempt(generation, from, to, nextAttempt),
                            clock.instant().plusMillis(delay));
                }
            } finally {
                lock.unlock();
            }
            return;
        }
        LOG.warn("Fetch [{}, {}] failed after {} attempts: {}", from, to, nextAttempt, cause.getMessage());
        publisher.publishEvent(new RemoteFetchFailedEvent(from, to, nextAttempt, cause.getMessage(), clock.instant()));
    }

    // --- helpers, lock held unless noted ---

    private ConnectionStateChangedEvent transition(ConnectionState to, String reason) {
        ConnectionState from = state;
        state = to;
        if (from == to) {
            return null;
        }
        return new ConnectionStateChangedEvent(from, to, reconnectAttempts, reason, clock.instant());
    }

    private void rescheduleHeartbeatTimeout(long generation) {
        cancel(heartbeatTimeoutTask);
        heartbeatTimeoutTask = scheduler.schedule(() -> onHeartbeatTimeout(generation),
                clock.instant().plus(heartbeatTimeout));
    }

    private void cancelConnectionTimers() {
        cancel(heartbeatTask);
        cancel(heartbeatTimeoutTask);
        cancel(reconnectTask);
        heartbeatTask = null;
        heartbeatTimeoutTask = null;
        reconnectTask = null;
    }

    private boolean isCurrent(long generation) {
        lock.lock();
        try {
            return generation == connectionGeneration;
        } finally {
            lock.unlock();
        }
    }

    /** Called without the lock. */
    private void publish(ConnectionStateChangedEvent change) {
        if (change == null) {
            return;
        }
        metrics.recordConnectionTransition(change.current());
        publisher.publishEvent(change);
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof CancellationException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Channel callbacks bound to one connection generation; callbacks of superseded
     * connections are ignored.
     */
    private final class ChannelCallbacks implements PushChannel.Listener {
        private final long generation;

        private ChannelCallbacks(long generation) {
            this.generation = generation;
        }

        @Override
        public void onOpen() {
            onChannelOpen(generation);
        }

        @Override
        public void onMessage(String text) {
            onChannelMessage(generation, text);
        }

        @Override
        public void onClosed(String reason) {
            onTransportFailure(generation, "closed_by_server", null);
        }

        @Override
        public void onFailure(Throwable error) {
            onTransportFailure(generation, "transport_error", error);
        }
    }
}
