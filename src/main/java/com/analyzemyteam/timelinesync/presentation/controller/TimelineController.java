package com.analyzemyteam.timelinesync.presentation.controller;

import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;
import com.analyzemyteam.timelinesync.presentation.dto.CallOverrideRequest;
import com.analyzemyteam.timelinesync.presentation.dto.FormationMarkRequest;
import com.analyzemyteam.timelinesync.service.cache.EventCache;
import com.analyzemyteam.timelinesync.service.coordinator.SyncCoordinator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Event lookups on the timeline plus manual formation marks, call overrides and alert acknowledgements.
 */
@RestController
@RequestMapping("/api/timeline")
class TimelineController {

    private final EventCache cache;
    private final SyncCoordinator coordinator;

    TimelineController(EventCache cache, SyncCoordinator coordinator) {
        this.cache = cache;
        this.coordinator = coordinator;
    }

    /** Exact, interpolated or nearest event of a kind at a position. */
    @GetMapping("/events/{kind}")
    ResponseEntity<SyncEvent> eventAt(@PathVariable String kind, @RequestParam long timestamp) {
        return cache.at(parseKind(kind), timestamp)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/events/{kind}/range")
    List<SyncEvent> eventsInRange(@PathVariable String kind, @RequestParam long from, @RequestParam long to) {
        return cache.range(parseKind(kind), from, to);
    }

    @GetMapping("/alerts")
    List<SyncEvent> activeAlerts() {
        return cache.activeAlerts();
    }

    @PostMapping("/alerts/{id}/acknowledge")
    ResponseEntity<SyncEvent> acknowledge(@PathVariable String id) {
        return coordinator.acknowledgeAlert(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/formations")
    ResponseEntity<SyncEvent> markFormation(@Valid @RequestBody FormationMarkRequest request) {
        FormationType type = FormationType.fromWire(request.formationType());
        if (type == FormationType.UNKNOWN) {
            throw new IllegalArgumentException("Unknown formation type: " + request.formationType());
        }
        double confidence = request.confidence() == null ? SyncEvent.DEFAULT_CONFIDENCE : request.confidence();
        SyncEvent event = coordinator.markFormation(request.videoTimestamp(), type, confidence);
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @PostMapping("/calls")
    ResponseEntity<SyncEvent> overrideCall(@Valid @RequestBody CallOverrideRequest request) {
        TriangleCallType call = parseCall(request.call());
        SyncEvent event = coordinator.overrideTriangleCall(request.videoTimestamp(), call, request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    private static EventKind parseKind(String kind) {
        return EventKind.fromWire(kind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + kind));
    }

    private static TriangleCallType parseCall(String call) {
        try {
            return TriangleCallType.valueOf(call.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown triangle call: " + call, ex);
        }
    }
}
