package com.analyzemyteam.timelinesync.domain;

import java.util.Objects;

/**
 * UI-facing timeline marker derived from an event (or created as a manual annotation).
 *
 * <p>Markers are owned by value by the marker manager; consumers hold marker ids only.
 *
 * @param markerId      unique marker id ({@code <prefix>_<eventId>} for derived markers)
 * @param sourceEventId id of the source event, null for annotations
 * @param kind          marker category
 * @param videoTimestamp position on the timeline in ms
 * @param label         short label drawn on the timeline
 * @param description   longer tooltip text
 * @param color         render colour
 * @param heightScale   relative height in [0.1, 1.0]
 * @param priority      draw priority in [0, 10]
 * @param animated      whether the renderer should pulse the marker
 * @param userCreated   manual markers are never auto-evicted
 */
public record Marker(
        String markerId,
        String sourceEventId,
        MarkerKind kind,
        long videoTimestamp,
        String label,
        String description,
        MarkerColor color,
        double heightScale,
        int priority,
        boolean animated,
        boolean userCreated
) {

    public static final double MIN_HEIGHT = 0.1;
    public static final double MAX_HEIGHT = 1.0;
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;

    public Marker {
        Objects.requireNonNull(markerId, "markerId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(color, "color");
        label = label == null ? "" : label;
        description = description == null ? "" : description;
        videoTimestamp = Math.max(0L, videoTimestamp);
        heightScale = Double.isNaN(heightScale) ? MIN_HEIGHT : Math.max(MIN_HEIGHT, Math.min(MAX_HEIGHT, heightScale));
        priority = Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }

    public Marker withId(String newId) {
        return new Marker(newId, sourceEventId, kind, videoTimestamp, label, description, color,
                heightScale, priority, animated, userCreated);
    }
}
