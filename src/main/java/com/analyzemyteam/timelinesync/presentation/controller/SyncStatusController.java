package com.analyzemyteam.timelinesync.presentation.controller;

import com.analyzemyteam.timelinesync.domain.SyncStatistics;
import com.analyzemyteam.timelinesync.presentation.dto.SyncStatusResponse;
import com.analyzemyteam.timelinesync.service.cache.EventCache;
import com.analyzemyteam.timelinesync.service.coordinator.SyncCoordinator;
import com.analyzemyteam.timelinesync.service.marker.MarkerManager;
import com.analyzemyteam.timelinesync.service.remote.RemoteSyncClient;
import com.analyzemyteam.timelinesync.service.stats.SyncStatisticsTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
class SyncStatusController {

    private static final Logger LOG = LogManager.getLogger(SyncStatusController.class);

    private final SyncCoordinator coordinator;
    private final RemoteSyncClient remote;
    private final SyncStatisticsTracker statistics;
    private final EventCache cache;
    private final MarkerManager markers;

    SyncStatusController(SyncCoordinator coordinator,
                         RemoteSyncClient remote,
                         SyncStatisticsTracker statistics,
                         EventCache cache,
                         MarkerManager markers) {
        this.coordinator = coordinator;
        this.remote = remote;
        this.statistics = statistics;
        this.cache = cache;
        this.markers = markers;
    }

    @GetMapping("/status")
    SyncStatusResponse status() {
        SyncStatistics snapshot = statistics.snapshot();
        return new SyncStatusResponse(
                remote.isEnabled(),
                remote.status(),
                snapshot,
                snapshot.cacheHitRatio(),
                coordinator.currentPosition(),
                coordinator.isPlaying(),
                coordinator.playbackRate(),
                coordinator.currentTickIntervalMs(),
                coordinator.queueDepth(),
                cache.size(),
                markers.size());
    }

    @PostMapping("/reconnect")
    ResponseEntity<Void> reconnect() {
        LOG.info("Manual reconnect requested");
        remote.reconnect();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/statistics/reset")
    ResponseEntity<Void> resetStatistics() {
        coordinator.resetStatistics();
        return ResponseEntity.noContent().build();
    }
}
