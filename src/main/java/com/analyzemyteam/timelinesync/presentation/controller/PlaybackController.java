package com.analyzemyteam.timelinesync.presentation.controller;

import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.service.coordinator.SyncCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP bridge for video sources that cannot call {@link SyncCoordinator} in-process.
 */
@RestController
@RequestMapping("/api/playback")
class PlaybackController {

    private final SyncCoordinator coordinator;

    PlaybackController(SyncCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/started")
    ResponseEntity<Void> started() {
        coordinator.onPlaybackStarted();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/stopped")
    ResponseEntity<Void> stopped() {
        coordinator.onPlaybackStopped();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/position")
    ResponseEntity<Void> position(@RequestParam long ms) {
        coordinator.setVideoPosition(ms);
        return ResponseEntity.accepted().build();
    }

    /** Seeks and returns the events active at the new position. */
    @PostMapping("/seek")
    ResponseEntity<Map<EventKind, SyncEvent>> seek(@RequestParam long ms) {
        coordinator.onSeek(ms);
        return ResponseEntity.ok(coordinator.eventsAt(coordinator.currentPosition()));
    }

    @PostMapping("/rate")
    ResponseEntity<Map<String, Object>> rate(@RequestParam double value) {
        coordinator.onRateChanged(value);
        return ResponseEntity.ok(Map.of(
                "rate", coordinator.playbackRate(),
                "tickIntervalMs", coordinator.currentTickIntervalMs()));
    }
}
