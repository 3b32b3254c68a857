package com.analyzemyteam.timelinesync.service.stats;

import com.analyzemyteam.timelinesync.domain.SyncStatistics;
import com.analyzemyteam.timelinesync.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class SyncStatisticsTrackerTest {

    private final MutableClock clock = new MutableClock(10_000L);
    private final SyncStatisticsTracker tracker = new SyncStatisticsTracker(clock);

    @Test
    void countsAndComputesHitRatio() {
        tracker.recordCacheHit();
        tracker.recordCacheHit();
        tracker.recordCacheHit();
        tracker.recordCacheMiss();
        tracker.recordEventProcessed();
        tracker.recordDropped();
        tracker.recordEvicted(3);
        tracker.recordEvicted(0);

        SyncStatistics stats = tracker.snapshot();

        assertThat(stats.cacheHitRatio()).isEqualTo(0.75);
        assertThat(stats.eventsProcessed()).isEqualTo(1);
        assertThat(stats.droppedEvents()).isEqualTo(1);
        assertThat(stats.evictedEvents()).isEqualTo(3);
        assertThat(stats.capturedAt()).isEqualTo(Instant.ofEpochMilli(10_000L));
    }

    @Test
    void hitRatioIsZeroWithoutLookups() {
        assertThat(tracker.snapshot().cacheHitRatio()).isZero();
    }

    @Test
    void latencyIsRollingAverageOverWindow() {
        for (int i = 0; i < SyncStatisticsTracker.LATENCY_WINDOW; i++) {
            tracker.recordLatency(10);
        }
        assertThat(tracker.snapshot().averageLatencyMs()).isEqualTo(10.0);

        for (int i = 0; i < SyncStatisticsTracker.LATENCY_WINDOW / 2; i++) {
            tracker.recordLatency(30);
        }
        tracker.recordLatency(-5);

        assertThat(tracker.snapshot().averageLatencyMs()).isEqualTo(20.0, offset(1e-9));
    }

    @Test
    void resetClearsEverything() {
        tracker.recordSyncOperation();
        tracker.recordNetworkRequest();
        tracker.recordPersistenceFailure();
        tracker.recordLatency(50);

        tracker.reset();

        SyncStatistics stats = tracker.snapshot();
        assertThat(stats.syncOperations()).isZero();
        assertThat(stats.networkRequests()).isZero();
        assertThat(stats.persistenceFailures()).isZero();
        assertThat(stats.averageLatencyMs()).isZero();
    }

    @Test
    void countersAreThreadSafe() throws InterruptedException {
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                for (int i = 0; i < perThread; i++) {
                    tracker.recordEventProcessed();
                }
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(tracker.snapshot().eventsProcessed()).isEqualTo((long) threads * perThread);
    }
}
