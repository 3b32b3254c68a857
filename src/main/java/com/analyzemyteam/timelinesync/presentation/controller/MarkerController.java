package com.analyzemyteam.timelinesync.presentation.controller;

import com.analyzemyteam.timelinesync.domain.Marker;
import com.analyzemyteam.timelinesync.domain.MarkerColor;
import com.analyzemyteam.timelinesync.domain.MarkerKind;
import com.analyzemyteam.timelinesync.presentation.dto.MarkerRequest;
import com.analyzemyteam.timelinesync.service.marker.MarkerManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Timeline markers for the UI layer: queries, manual annotations, visibility and export.
 */
@RestController
@RequestMapping("/api/timeline")
class MarkerController {

    private static final Logger LOG = LogManager.getLogger(MarkerController.class);

    private final MarkerManager markers;

    MarkerController(MarkerManager markers) {
        this.markers = markers;
    }

    @GetMapping("/markers")
    List<Marker> markersInRange(@RequestParam long from, @RequestParam long to) {
        return markers.markersInRange(from, to);
    }

    @GetMapping("/markers/nearest")
    ResponseEntity<Marker> nearest(@RequestParam long timestamp, @RequestParam String kind) {
        return markers.nearestMarker(timestamp, parseKind(kind))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/markers")
    ResponseEntity<Marker> addMarker(@RequestBody MarkerRequest request) {
        MarkerColor color = request.color() == null || request.color().isBlank()
                ? null
                : MarkerColor.fromHex(request.color());
        Marker marker = markers.addMarker(
                request.markerId(),
                request.videoTimestamp(),
                request.label(),
                request.description(),
                color,
                request.heightScale() == null ? 0.0 : request.heightScale(),
                request.priority() == null ? -1 : request.priority());
        return ResponseEntity.status(HttpStatus.CREATED).body(marker);
    }

    @DeleteMapping("/markers/{id}")
    ResponseEntity<Void> removeMarker(@PathVariable String id) {
        markers.removeMarker(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/visibility/{kind}")
    ResponseEntity<Map<String, Object>> setVisibility(@PathVariable String kind, @RequestParam boolean visible) {
        MarkerKind markerKind = parseKind(kind);
        markers.setVisibility(markerKind, visible);
        return ResponseEntity.ok(Map.of("kind", markerKind.name(), "visible", visible));
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    String export() {
        return markers.exportJson();
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> importMarkers(@RequestBody String body) {
        int imported = markers.importJson(body);
        LOG.info("Marker import via API: {} markers", imported);
        return ResponseEntity.ok(Map.of("imported", imported, "total", markers.size()));
    }

    private static MarkerKind parseKind(String kind) {
        return MarkerKind.fromName(kind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown marker kind: " + kind));
    }
}
