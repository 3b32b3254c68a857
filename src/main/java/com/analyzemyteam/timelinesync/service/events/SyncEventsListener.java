package com.analyzemyteam.timelinesync.service.events;

import com.analyzemyteam.timelinesync.domain.ConnectionState;
import com.analyzemyteam.timelinesync.service.coordinator.event.EventDroppedEvent;
import com.analyzemyteam.timelinesync.service.remote.event.ConnectionStateChangedEvent;
import com.analyzemyteam.timelinesync.service.remote.event.RemoteFetchFailedEvent;
import com.analyzemyteam.timelinesync.service.remote.event.RemoteMessageDroppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central operator-facing log of sync problems. Throttled per key to avoid log spam while the
 * backend is flapping or a producer keeps sending bad data.
 */
@Component
class SyncEventsListener {
    private static final Logger LOG = LogManager.getLogger(SyncEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onConnectionStateChanged(ConnectionStateChangedEvent e) {
        if (e.current() == ConnectionState.DEGRADED) {
            if (shouldLog("connection-degraded")) {
                LOG.error("Remote sync degraded after {} reconnect attempts ({}). "
                        + "Serving cached and stored events only; POST /api/sync/reconnect to retry.",
                        e.reconnectAttempts(), e.reason());
            }
        } else if (e.current() == ConnectionState.CONNECTED) {
            LOG.info("Remote sync connected (previous state {})", e.previous());
        } else if (e.current() == ConnectionState.DISCONNECTED && e.previous() == ConnectionState.CONNECTED) {
            if (shouldLog("connection-lost")) {
                LOG.warn("Remote sync connection lost: {}", e.reason());
            }
        }
    }

    @EventListener
    void onFetchFailed(RemoteFetchFailedEvent e) {
        if (shouldLog("fetch-failed")) {
            LOG.warn("Fetch of [{}, {}] failed after {} attempts: {}", e.fromMs(), e.toMs(), e.attempts(), e.reason());
        }
    }

    @EventListener
    void onMessageDropped(RemoteMessageDroppedEvent e) {
        String key = "message-dropped-" + e.messageType();
        if (shouldLog(key)) {
            LOG.warn("Dropped push message: type={}, reason={}", e.messageType(), e.reason());
        }
    }

    @EventListener
    void onEventDropped(EventDroppedEvent e) {
        String key = "event-dropped-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Dropped event: id={}, reason={}, detail={}", e.eventId(), e.reason(), e.detail());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
