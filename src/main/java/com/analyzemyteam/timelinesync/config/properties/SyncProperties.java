package com.analyzemyteam.timelinesync.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the synchronization engine ({@code sync.*}).
 *
 * <p>Top-level values are the engine's primary tuning knobs; nested groups cover the
 * event queue, remote fetch windows, marker housekeeping, periodic timers and the
 * remote backend connection.
 */
@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /** Base sync tick interval at 1x playback rate. */
    @Positive(message = "Sync interval must be positive")
    private long syncIntervalMs = 100;

    /** Upper bound on cached events; oldest non-user events are evicted beyond it. */
    @Positive(message = "Max cached events must be positive")
    private int maxCachedEvents = 10_000;

    /** Upper bound on markers; oldest non-user markers are evicted beyond it. */
    @Positive(message = "Max markers must be positive")
    private int maxMarkers = 10_000;

    /** Rows older than this are deleted from the local store by the cleanup tick. */
    @Positive(message = "Retention hours must be positive")
    private int retentionHours = 24;

    @Positive(message = "Reconnect backoff must be positive")
    private long reconnectBackoffMs = 5_000;

    @Min(value = 0, message = "Max reconnect attempts must not be negative")
    private int maxReconnectAttempts = 10;

    /** Both neighbours must be within this distance for a lookup to interpolate. */
    @Positive(message = "Interpolation gap must be positive")
    private long interpolationMaxGapMs = 5_000;

    /** A lone nearest neighbour is returned only within this distance. */
    @Positive(message = "Nearest gap must be positive")
    private long nearestMaxGapMs = 10_000;

    /** Adaptive tick interval is clamped into [minTickMs, maxTickMs]. */
    @Positive
    private long minTickMs = 10;

    @Positive
    private long maxTickMs = 1_000;

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Markers markers = new Markers();

    @Valid
    private Timers timers = new Timers();

    @Valid
    private Remote remote = new Remote();

    public long getSyncIntervalMs() {
        return syncIntervalMs;
    }

    public void setSyncIntervalMs(long syncIntervalMs) {
        this.syncIntervalMs = syncIntervalMs;
    }

    public int getMaxCachedEvents() {
        return maxCachedEvents;
    }

    public void setMaxCachedEvents(int maxCachedEvents) {
        this.maxCachedEvents = maxCachedEvents;
    }

    public int getMaxMarkers() {
        return maxMarkers;
    }

    public void setMaxMarkers(int maxMarkers) {
        this.maxMarkers = maxMarkers;
    }

    public int getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(int retentionHours) {
        this.retentionHours = retentionHours;
    }

    public long getReconnectBackoffMs() {
        return reconnectBackoffMs;
    }

    public void setReconnectBackoffMs(long reconnectBackoffMs) {
        this.reconnectBackoffMs = reconnectBackoffMs;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public long getInterpolationMaxGapMs() {
        return interpolationMaxGapMs;
    }

    public void setInterpolationMaxGapMs(long interpolationMaxGapMs) {
        this.interpolationMaxGapMs = interpolationMaxGapMs;
    }

    public long getNearestMaxGapMs() {
        return nearestMaxGapMs;
    }

    public void setNearestMaxGapMs(long nearestMaxGapMs) {
        this.nearestMaxGapMs = nearestMaxGapMs;
    }

    public long getMinTickMs() {
        return minTickMs;
    }

    public void setMinTickMs(long minTickMs) {
        this.minTickMs = minTickMs;
    }

    public long getMaxTickMs() {
        return maxTickMs;
    }

    public void setMaxTickMs(long maxTickMs) {
        this.maxTickMs = maxTickMs;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Markers getMarkers() {
        return markers;
    }

    public void setMarkers(Markers markers) {
        this.markers = markers;
    }

    public Timers getTimers() {
        return timers;
    }

    public void setTimers(Timers timers) {
        this.timers = timers;
    }

    public Remote getRemote() {
        return remote;
    }

    public void setRemote(Remote remote) {
        this.remote = remote;
    }

    /**
     * Bounded inbound event queue.
     */
    public static class Queue {
        @Positive
        private int capacity = 1_000;

        @Positive
        private int drainPerTick = 50;

        /** Coaching alerts at or above this priority displace low-priority queue entries. */
        @Min(1)
        private int criticalAlertPriority = 4;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getDrainPerTick() {
            return drainPerTick;
        }

        public void setDrainPerTick(int drainPerTick) {
            this.drainPerTick = drainPerTick;
        }

        public int getCriticalAlertPriority() {
            return criticalAlertPriority;
        }

        public void setCriticalAlertPriority(int criticalAlertPriority) {
            this.criticalAlertPriority = criticalAlertPriority;
        }
    }

    /**
     * Remote fetch windows and retry policy.
     */
    public static class Fetch {
        /** Minimum wall-clock time between position-driven fetches. */
        @Positive
        private long debounceMs = 30_000;

        /** Half-width of the window fetched around the playhead. */
        @Positive
        private long windowMs = 300_000;

        @Positive
        private long timeoutMs = 10_000;

        @Min(0)
        private int maxRetries = 3;

        /** Linear backoff step between fetch retries. */
        @Positive
        private long retryBackoffMs = 1_000;

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    /**
     * Marker lookup and housekeeping.
     */
    public static class Markers {
        @Positive
        private long nearestToleranceMs = 1_000;

        /** Non-user markers further than this behind the playhead are swept. */
        @Positive
        private long retentionMs = 3_600_000;

        @Positive
        private long sweepIntervalMs = 300_000;

        @Positive
        private long animationIntervalMs = 500;

        /** Animated markers within this distance of the playhead are reported as active. */
        @Positive
        private long animationWindowMs = 5_000;

        public long getNearestToleranceMs() {
            return nearestToleranceMs;
        }

        public void setNearestToleranceMs(long nearestToleranceMs) {
            this.nearestToleranceMs = nearestToleranceMs;
        }

        public long getRetentionMs() {
            return retentionMs;
        }

        public void setRetentionMs(long retentionMs) {
            this.retentionMs = retentionMs;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }

        public long getAnimationIntervalMs() {
            return animationIntervalMs;
        }

        public void setAnimationIntervalMs(long animationIntervalMs) {
            this.animationIntervalMs = animationIntervalMs;
        }

        public long getAnimationWindowMs() {
            return animationWindowMs;
        }

        public void setAnimationWindowMs(long animationWindowMs) {
            this.animationWindowMs = animationWindowMs;
        }
    }

    /**
     * Periodic housekeeping timers.
     */
    public static class Timers {
        @Positive
        private long statisticsIntervalMs = 5_000;

        @Positive
        private long cleanupIntervalMs = 3_600_000;

        public long getStatisticsIntervalMs() {
            return statisticsIntervalMs;
        }

        public void setStatisticsIntervalMs(long statisticsIntervalMs) {
            this.statisticsIntervalMs = statisticsIntervalMs;
        }

        public long getCleanupIntervalMs() {
            return cleanupIntervalMs;
        }

        public void setCleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
        }
    }

    /**
     * Remote analytics backend.
     */
    public static class Remote {
        /** When false the engine runs offline from the local store only. */
        private boolean enabled = true;

        private String baseUrl = "http://localhost:8090/api";

        private String pushUrl = "ws://localhost:8090/realtime";

        /** Sent as bearer token and {@code apikey} header when non-blank. */
        private String apiKey = "";

        private String clientId = "timeline-sync";

        @Positive
        private long heartbeatIntervalMs = 15_000;

        @Positive
        private long heartbeatTimeoutMs = 30_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPushUrl() {
            return pushUrl;
        }

        public void setPushUrl(String pushUrl) {
            this.pushUrl = pushUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public long getHeartbeatTimeoutMs() {
            return heartbeatTimeoutMs;
        }

        public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) {
            this.heartbeatTimeoutMs = heartbeatTimeoutMs;
        }
    }
}
