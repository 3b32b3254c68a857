package com.analyzemyteam.timelinesync.service.coordinator;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.ConnectionState;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.MelScores;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallPayload;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;
import com.analyzemyteam.timelinesync.service.cache.EventCache;
import com.analyzemyteam.timelinesync.service.coordinator.event.AnimatedMarkersChangedEvent;
import com.analyzemyteam.timelinesync.service.coordinator.event.EventDroppedEvent;
import com.analyzemyteam.timelinesync.service.coordinator.event.StatisticsUpdatedEvent;
import com.analyzemyteam.timelinesync.service.coordinator.event.TriangleCallChangedEvent;
import com.analyzemyteam.timelinesync.service.marker.MarkerManager;
import com.analyzemyteam.timelinesync.service.marker.event.MarkerRemovedEvent;
import com.analyzemyteam.timelinesync.service.metrics.SyncMetrics;
import com.analyzemyteam.timelinesync.service.remote.PushMessage;
import com.analyzemyteam.timelinesync.service.remote.RemoteSyncClient;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import com.analyzemyteam.timelinesync.testutil.EventCapturingPublisher;
import com.analyzemyteam.timelinesync.testutil.FakePushChannel;
import com.analyzemyteam.timelinesync.testutil.FakeRemoteEventApi;
import com.analyzemyteam.timelinesync.testutil.InMemoryEventStore;
import com.analyzemyteam.timelinesync.testutil.ManualTaskScheduler;
import com.analyzemyteam.timelinesync.testutil.MutableClock;
import com.analyzemyteam.timelinesync.testutil.TestEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncCoordinatorTest {

    private static final long NOW = 1_000_000L;

    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private EventCapturingPublisher publisher;
    private SyncStatisticsTracker statistics;
    private InMemoryEventStore store;
    private FakeRemoteEventApi api;
    private FakePushChannel channel;
    private SyncProperties properties;

    private EventCache cache;
    private MarkerManager markers;
    private RemoteSyncClient remote;
    private SyncCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        scheduler = new ManualTaskScheduler(clock);
        publisher = new EventCapturingPublisher();
        statistics = new SyncStatisticsTracker(clock);
        store = new InMemoryEventStore();
        api = new FakeRemoteEventApi();
        channel = new FakePushChannel();
        properties = new SyncProperties();
    }

    private void build() {
        SyncMetrics metrics = new SyncMetrics(new SimpleMeterRegistry());
        cache = new EventCache(properties, statistics);
        markers = new MarkerManager(properties, publisher, clock);
        remote = new RemoteSyncClient(api, channel, scheduler, publisher, statistics, metrics, properties, clock);
        coordinator = new SyncCoordinator(cache, markers, store, remote, scheduler, publisher, statistics,
                metrics, properties, clock);
    }

    private static SyncEvent formation(String id, long videoTs, FormationType type, TriangleCallType call,
                                       String hash, String zone, double confidence) {
        return SyncEvent.of(id, videoTs, NOW, confidence,
                new FormationPayload(type, call, hash, zone, List.of(), MelScores.EMPTY));
    }

    private void push(SyncEvent event) {
        coordinator.onPushMessage(new PushMessage.EventMessage("formation_detected", event));
    }

    @Test
    void startRestoresStoreConnectsAndFetchesAroundPlayhead() {
        store.save(TestEvents.formation("formation_1", 2_000, NOW - 10));
        build();

        coordinator.start();
        coordinator.start();

        assertThat(coordinator.isRunning()).isTrue();
        assertThat(cache.findById(EventKind.FORMATION, "formation_1")).isPresent();
        assertThat(markers.findMarker("formation_formation_1")).isPresent();
        assertThat(channel.openCount()).isEqualTo(1);
        assertThat(api.requestCount()).isEqualTo(1);
        assertThat(api.last().fromMs()).isZero();
        assertThat(api.last().toMs()).isEqualTo(properties.getFetch().getWindowMs());
    }

    @Test
    void startSurvivesUnreadableStore() {
        store.setFailLoad(true);
        build();

        coordinator.start();

        assertThat(coordinator.isRunning()).isTrue();
        assertThat(cache.size()).isZero();
    }

    @Test
    void scheduledTickAppliesQueuedEventsAndReschedules() {
        build();
        coordinator.start();
        push(formation("formation_7", 5_000, FormationType.RITA, TriangleCallType.NO_CALL, "L", "", 0.6));
        assertThat(coordinator.queueDepth()).isEqualTo(1);

        scheduler.advance(Duration.ofMillis(properties.getSyncIntervalMs()));

        assertThat(coordinator.queueDepth()).isZero();
        SyncEvent applied = cache.findById(EventKind.FORMATION, "formation_7").orElseThrow();
        assertThat(applied.payloadAs(FormationPayload.class).recommendedCall()).isEqualTo(TriangleCallType.LEFT_HASH);
        assertThat(store.get(EventKind.FORMATION, "formation_7")).isEqualTo(applied);
        assertThat(markers.findMarker("formation_formation_7")).isPresent();
        assertThat(statistics.snapshot().eventsProcessed()).isEqualTo(1);

        push(TestEvents.alert("alert_1", 6_000, NOW, 2));
        scheduler.advance(Duration.ofMillis(properties.getSyncIntervalMs()));
        assertThat(cache.findById(EventKind.COACHING_ALERT, "alert_1")).isPresent();
    }

    @Test
    void fetchedEventsAreQueuedLikePushedOnes() {
        build();
        coordinator.onFetchCompleted(0, 10_000, List.of(
                TestEvents.formation("formation_1", 1_000, NOW),
                TestEvents.mel("mel_x", 1_000, NOW, 50, 50, 50)));

        coordinator.tick();

        assertThat(cache.size()).isEqualTo(2);
        assertThat(statistics.snapshot().syncOperations()).isEqualTo(1);
    }

    @Test
    void criticalAlertDisplacesLowPriorityWorkWhenQueueIsFull() {
        properties.getQueue().setCapacity(2);
        build();
        push(TestEvents.formation("formation_1", 1_000, NOW));
        push(TestEvents.formation("formation_2", 2_000, NOW));

        push(TestEvents.alert("alert_critical", 1_500, NOW, 5));
        push(TestEvents.formation("formation_3", 3_000, NOW));

        assertThat(publisher.ofType(EventDroppedEvent.class))
                .extracting(EventDroppedEvent::eventId)
                .containsExactly("formation_1", "formation_3");
        assertThat(publisher.ofType(EventDroppedEvent.class).get(0).detail()).contains("alert_critical");
        assertThat(statistics.snapshot().droppedEvents()).isEqualTo(2);

        coordinator.tick();

        assertThat(cache.findById(EventKind.COACHING_ALERT, "alert_critical")).isPresent();
        assertThat(cache.findById(EventKind.FORMATION, "formation_1")).isEmpty();
        assertThat(cache.findById(EventKind.FORMATION, "formation_2")).isPresent();
    }

    @Test
    void positionTicksAreNotReportedAsDroppedEvents() {
        properties.getQueue().setCapacity(1);
        build();
        coordinator.onFetchCompleted(0, 60_000, List.of(TestEvents.formation("formation_1", 2_000, NOW)));
        coordinator.tick();

        coordinator.setVideoPosition(1_000);
        coordinator.setVideoPosition(2_000);
        push(TestEvents.alert("alert_critical", 2_500, NOW, 5));

        assertThat(publisher.ofType(EventDroppedEvent.class)).isEmpty();
        assertThat(statistics.snapshot().droppedEvents()).isZero();

        push(TestEvents.formation("formation_2", 3_000, NOW));
        assertThat(publisher.ofType(EventDroppedEvent.class))
                .extracting(EventDroppedEvent::eventId)
                .containsExactly("formation_2");

        coordinator.tick();

        assertThat(cache.findById(EventKind.COACHING_ALERT, "alert_critical")).isPresent();
        // the playhead is still resolved although its position tick was displaced
        assertThat(publisher.last(TriangleCallChangedEvent.class).formationEventId()).isEqualTo("formation_1");
    }

    @Test
    void cacheEvictionRemovesMarkersOfEvictedEvents() {
        properties.setMaxCachedEvents(2);
        build();
        push(TestEvents.formation("formation_1", 1_000, NOW));
        push(TestEvents.formation("formation_2", 2_000, NOW + 1));
        push(TestEvents.formation("formation_3", 3_000, NOW + 2));

        coordinator.tick();

        assertThat(cache.size()).isEqualTo(2);
        assertThat(markers.size()).isEqualTo(cache.size());
        assertThat(markers.findMarker("formation_formation_1")).isEmpty();
        assertThat(markers.findMarker("formation_formation_3")).isPresent();
        assertThat(publisher.ofType(MarkerRemovedEvent.class))
                .extracting(MarkerRemovedEvent::markerId)
                .containsExactly("formation_formation_1");
    }

    @Test
    void eventEvictedOnArrivalGetsNoMarker() {
        properties.setMaxCachedEvents(1);
        build();
        push(TestEvents.formation("formation_new", 1_000, NOW));
        push(TestEvents.formation("formation_old", 2_000, NOW - 60_000));

        coordinator.tick();

        assertThat(cache.findById(EventKind.FORMATION, "formation_new")).isPresent();
        assertThat(cache.findById(EventKind.FORMATION, "formation_old")).isEmpty();
        assertThat(markers.findMarker("formation_formation_old")).isEmpty();
        assertThat(markers.size()).isEqualTo(1);
    }

    @Test
    void highUrgencyFormationRaisesAlertOnce() {
        build();
        push(formation("formation_9", 4_000, FormationType.LINDA, TriangleCallType.NO_CALL, "", "Red Zone", 0.95));
        coordinator.tick();

        SyncEvent formation = cache.findById(EventKind.FORMATION, "formation_9").orElseThrow();
        assertThat(formation.payloadAs(FormationPayload.class).recommendedCall()).isEqualTo(TriangleCallType.GOAL_LINE);
        assertThat(coordinator.acknowledgeAlert("urgency_formation_9")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        push(formation("formation_9", 4_000, FormationType.LINDA, TriangleCallType.NO_CALL, "", "Red Zone", 0.99)
                .withIngestTimestamp(clock.millis()));
        coordinator.tick();

        SyncEvent alert = cache.findById(EventKind.COACHING_ALERT, "urgency_formation_9").orElseThrow();
        assertThat(alert.payloadAs(CoachingAlertPayload.class).acknowledged()).isTrue();
        assertThat(cache.activeAlerts()).isEmpty();
    }

    @Test
    void completedMelStagesAccumulateOntoFormation() {
        build();
        push(TestEvents.formation("formation_f9", 7_000, NOW));
        coordinator.onPushMessage(new PushMessage.MelStageMessage("f9", "making", "completed", 90.0));
        coordinator.onPushMessage(new PushMessage.MelStageMessage("f9", "efficiency", "running", 10.0));
        coordinator.onPushMessage(new PushMessage.MelStageMessage("f9", "efficiency", "completed", 60.0));
        coordinator.onPushMessage(new PushMessage.MelStageMessage("f9", "logical", "completed", 30.0));
        coordinator.onPushMessage(new PushMessage.MelStageMessage("unknown", "making", "completed", 99.0));

        coordinator.tick();

        SyncEvent mel = cache.findById(EventKind.MEL_SCORE, "mel_f9").orElseThrow();
        MelScorePayload scores = mel.payloadAs(MelScorePayload.class);
        assertThat(mel.videoTimestamp()).isEqualTo(7_000L);
        assertThat(scores.makingScore()).isEqualTo(90.0);
        assertThat(scores.efficiencyScore()).isEqualTo(60.0);
        assertThat(scores.combinedScore()).isEqualTo(60.0);

        MelScores onFormation = cache.findById(EventKind.FORMATION, "formation_f9").orElseThrow()
                .payloadAs(FormationPayload.class).melScores();
        assertThat(onFormation.combined()).isEqualTo(60.0);
        assertThat(cache.findById(EventKind.MEL_SCORE, "mel_unknown")).isEmpty();
    }

    @Test
    void fullMelScoresWithExplicitPositionNeedNoFormation() {
        build();
        MelScorePayload payload = new MelScorePayload("f1", 80, 70, 60, 70, "completed");
        coordinator.onPushMessage(new PushMessage.MelScoresMessage("f1", 12_000, payload));

        coordinator.tick();

        assertThat(cache.findById(EventKind.MEL_SCORE, "mel_f1"))
                .map(SyncEvent::videoTimestamp)
                .contains(12_000L);
    }

    @Test
    void tracksTriangleCallAtPlayhead() {
        build();
        coordinator.onFetchCompleted(0, 60_000, List.of(
                TestEvents.formation("formation_a", 10_000, NOW),
                formation("formation_b", 40_000, FormationType.RANDY, TriangleCallType.WEAK_SIDE, "", "", 0.7)));
        coordinator.tick();

        coordinator.onSeek(10_000);
        TriangleCallChangedEvent first = publisher.last(TriangleCallChangedEvent.class);
        assertThat(first.previous()).isEqualTo(TriangleCallType.NO_CALL);
        assertThat(first.current()).isEqualTo(TriangleCallType.STRONG_SIDE);

        coordinator.setVideoPosition(40_000);
        coordinator.tick();
        TriangleCallChangedEvent second = publisher.last(TriangleCallChangedEvent.class);
        assertThat(second.current()).isEqualTo(TriangleCallType.WEAK_SIDE);
        assertThat(second.formationEventId()).isEqualTo("formation_b");

        coordinator.setVideoPosition(40_000);
        coordinator.tick();
        assertThat(publisher.ofType(TriangleCallChangedEvent.class)).hasSize(2);
    }

    @Test
    void positionFetchesAreDebouncedButSeeksAreNot() {
        build();
        coordinator.start();
        assertThat(api.requestCount()).isEqualTo(1);

        coordinator.setVideoPosition(5_000);
        assertThat(api.requestCount()).isEqualTo(1);

        clock.advance(Duration.ofMillis(properties.getFetch().getDebounceMs() + 1));
        coordinator.setVideoPosition(400_000);
        assertThat(api.requestCount()).isEqualTo(2);
        assertThat(api.last().fromMs()).isEqualTo(100_000L);

        coordinator.onSeek(900_000);
        assertThat(api.requestCount()).isEqualTo(3);
        assertThat(coordinator.currentPosition()).isEqualTo(900_000L);
    }

    @Test
    void markFormationCreatesUserEventWithDerivedCall() {
        build();

        SyncEvent event = coordinator.markFormation(8_000, FormationType.RICKY, 0.7);

        assertThat(event.id()).isEqualTo("manual-formation-8000");
        assertThat(event.userCreated()).isTrue();
        assertThat(event.payloadAs(FormationPayload.class).recommendedCall()).isEqualTo(TriangleCallType.WEAK_SIDE);
        assertThat(markers.findMarker("formation_manual-formation-8000").orElseThrow().userCreated()).isTrue();
        assertThat(store.get(EventKind.FORMATION, "manual-formation-8000")).isNotNull();
    }

    @Test
    void callOverrideUpdatesFormationAtTimestamp() {
        build();
        coordinator.onFetchCompleted(0, 60_000, List.of(TestEvents.formation("formation_1", 10_000, NOW)));
        coordinator.tick();

        SyncEvent override = coordinator.overrideTriangleCall(10_000, TriangleCallType.RED_ZONE, "coach call");

        assertThat(override.id()).isEqualTo("manual-call-10000");
        assertThat(override.payloadAs(TriangleCallPayload.class).formationId()).isEqualTo("formation_1");
        assertThat(cache.findById(EventKind.FORMATION, "formation_1").orElseThrow()
                .payloadAs(FormationPayload.class).recommendedCall()).isEqualTo(TriangleCallType.RED_ZONE);

        SyncEvent orphan = coordinator.overrideTriangleCall(500_000, TriangleCallType.NO_CALL, "");
        assertThat(orphan.payloadAs(TriangleCallPayload.class).formationId()).isEmpty();
    }

    @Test
    void acknowledgeUnknownAlertIsEmpty() {
        build();

        assertThat(coordinator.acknowledgeAlert("missing")).isEmpty();
    }

    @Test
    void tickIntervalFollowsPlaybackRate() {
        build();

        coordinator.onRateChanged(2.0);
        assertThat(coordinator.currentTickIntervalMs()).isEqualTo(50L);
        coordinator.onRateChanged(-1.0);
        assertThat(coordinator.playbackRate()).isEqualTo(1.0);
        assertThat(coordinator.currentTickIntervalMs()).isEqualTo(100L);
        coordinator.onRateChanged(100.0);
        assertThat(coordinator.currentTickIntervalMs()).isEqualTo(properties.getMinTickMs());
        coordinator.onRateChanged(0.05);
        assertThat(coordinator.currentTickIntervalMs()).isEqualTo(properties.getMaxTickMs());
    }

    @Test
    void stopCancelsTickAndDisconnects() {
        build();
        coordinator.start();
        channel.simulateOpen();
        assertThat(remote.state()).isEqualTo(ConnectionState.CONNECTED);

        coordinator.stop();

        assertThat(coordinator.isRunning()).isFalse();
        assertThat(remote.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(scheduler.pendingCount()).isZero();

        coordinator.publishStatistics();
        assertThat(publisher.ofType(StatisticsUpdatedEvent.class)).isEmpty();
    }

    @Test
    void periodicJobsPublishStatisticsAndApplyRetention() {
        build();
        coordinator.start();
        coordinator.onFetchCompleted(0, 10_000, List.of(TestEvents.formation("formation_old", 1_000, NOW)));
        coordinator.tick();

        coordinator.publishStatistics();
        assertThat(publisher.last(StatisticsUpdatedEvent.class).statistics().eventsProcessed()).isEqualTo(1);

        clock.advance(Duration.ofHours(properties.getRetentionHours()).plusMinutes(1));
        coordinator.cleanup();

        assertThat(store.cleanupCalls()).isEqualTo(1);
        assertThat(cache.findById(EventKind.FORMATION, "formation_old")).isEmpty();
        assertThat(markers.findMarker("formation_formation_old")).isEmpty();
    }

    @Test
    void sweepDropsMarkersFarBehindPlayhead() {
        build();
        coordinator.start();
        coordinator.onFetchCompleted(0, 10_000, List.of(TestEvents.alert("alert_1", 1_000, NOW, 2)));
        coordinator.tick();

        coordinator.onSeek(properties.getMarkers().getRetentionMs() + 5_000);
        coordinator.sweepMarkers();

        assertThat(markers.findMarker("alert_alert_1")).isEmpty();
        assertThat(cache.findById(EventKind.COACHING_ALERT, "alert_1")).isPresent();
    }

    @Test
    void animatedMarkerChangesArePublishedOnce() {
        build();
        coordinator.start();
        coordinator.onFetchCompleted(0, 10_000, List.of(TestEvents.alert("alert_1", 1_000, NOW, 5)));
        coordinator.tick();

        coordinator.refreshAnimatedMarkers();
        coordinator.refreshAnimatedMarkers();

        assertThat(publisher.ofType(AnimatedMarkersChangedEvent.class)).hasSize(1);
        assertThat(publisher.last(AnimatedMarkersChangedEvent.class).markerIds()).containsExactly("alert_alert_1");
    }
}
