package com.analyzemyteam.timelinesync.service.store;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.persistence.FormationEventRepository;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import com.analyzemyteam.timelinesync.testutil.MutableClock;
import com.analyzemyteam.timelinesync.testutil.SyncExecutor;
import com.analyzemyteam.timelinesync.testutil.TestEvents;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({JpaEventStore.class, SyncStatisticsTracker.class, JpaEventStoreTest.StoreTestConfig.class})
class JpaEventStoreTest {

    private static final long NOW = 10 * 3_600_000L;

    @TestConfiguration
    static class StoreTestConfig {

        @Bean
        Clock clock() {
            return new MutableClock(NOW);
        }

        @Bean
        Executor persistenceExecutor() {
            return new SyncExecutor();
        }
    }

    @Autowired
    private JpaEventStore store;

    @Autowired
    private FormationEventRepository formations;

    @Autowired
    private Clock clock;

    @Test
    void savedEventsLoadNewestFirstWithPayloads() {
        store.save(TestEvents.formation("f1", 1_000, NOW, FormationType.LARRY, 0.9));
        store.save(TestEvents.alert("a1", 3_000, NOW, 5));
        store.save(TestEvents.mel("m1", 2_000, NOW, 60, 70, 80));

        List<SyncEvent> loaded = store.load(10);

        assertThat(loaded).extracting(SyncEvent::id).containsExactly("a1", "m1", "f1");
        assertThat(loaded.get(2).payloadAs(FormationPayload.class).formationType()).isEqualTo(FormationType.LARRY);
        assertThat(loaded.get(2).confidence()).isEqualTo(0.9);
        assertThat(loaded.get(0).payloadAs(CoachingAlertPayload.class).priorityLevel()).isEqualTo(5);
        assertThat(loaded.get(1).payloadAs(MelScorePayload.class).combinedScore()).isEqualTo(70.0);
    }

    @Test
    void saveIsAnUpsertById() {
        store.save(TestEvents.formation("f1", 1_000, NOW, FormationType.RITA, 0.5));
        store.save(TestEvents.formation("f1", 1_000, NOW + 1, FormationType.RICKY, 0.7));

        assertThat(formations.count()).isEqualTo(1);
        SyncEvent loaded = store.load(10).get(0);
        assertThat(loaded.payloadAs(FormationPayload.class).formationType()).isEqualTo(FormationType.RICKY);
        assertThat(loaded.ingestTimestamp()).isEqualTo(NOW + 1);
    }

    @Test
    void loadHonoursLimitAcrossKinds() {
        for (int i = 0; i < 5; i++) {
            store.save(TestEvents.formation("f" + i, i * 1_000L, NOW));
            store.save(TestEvents.alert("a" + i, i * 1_000L + 500, NOW, 2));
        }

        List<SyncEvent> loaded = store.load(3);

        assertThat(loaded).extracting(SyncEvent::id).containsExactly("a4", "f4", "a3");
        assertThat(store.load(0)).isEmpty();
    }

    @Test
    void cleanupDeletesOnlyOldNonUserRows() {
        long old = NOW - 25 * 3_600_000L;
        store.save(TestEvents.formation("old", 1_000, old));
        store.save(SyncEvent.userCreated("kept_user", 2_000, old, 1.0,
                TestEvents.formation("x", 0, 0).payload()));
        store.save(TestEvents.formation("fresh", 3_000, NOW));

        int deleted = store.cleanup(24);

        assertThat(deleted).isEqualTo(1);
        assertThat(store.load(10)).extracting(SyncEvent::id).containsExactlyInAnyOrder("kept_user", "fresh");
    }

    @Test
    void cleanupUsesTheInjectedClock() {
        store.save(TestEvents.formation("f1", 1_000, NOW));
        ((MutableClock) clock).advance(Duration.ofHours(2));
        try {
            assertThat(store.cleanup(1)).isEqualTo(1);
        } finally {
            ((MutableClock) clock).setMillis(NOW);
        }
    }

    @Test
    void deleteRemovesOneEventAndIgnoresMissingRows() {
        store.save(TestEvents.alert("a1", 1_000, NOW, 3));
        store.save(TestEvents.alert("a2", 2_000, NOW, 3));

        store.delete(EventKind.COACHING_ALERT, "a1");
        store.delete(EventKind.COACHING_ALERT, "missing");

        assertThat(store.load(10)).extracting(SyncEvent::id).containsExactly("a2");
        assertThat(store.pendingCount()).isZero();
    }

    @Test
    void saveAsyncRunsOnPersistenceExecutor() {
        store.saveAsync(TestEvents.formation("f1", 1_000, NOW));

        assertThat(formations.count()).isEqualTo(1);
    }
}
