package com.analyzemyteam.timelinesync.service.cache;

import com.analyzemyteam.timelinesync.domain.EventPayload;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;

/**
 * Linear interpolation between two events of the same kind that bracket a position.
 *
 * <p>Confidence and numeric score fields are interpolated. Every other field comes from the
 * temporally closer event; an exact tie favours the later event.
 */
public final class EventInterpolator {

    static final String SYNTHETIC_ID_PREFIX = "interp:";

    private EventInterpolator() {
    }

    /**
     * @param before event strictly before {@code position}
     * @param after  event strictly after {@code position}
     * @param position video position in ms
     * @return synthetic event at {@code position}
     */
    static SyncEvent interpolate(SyncEvent before, SyncEvent after, long position) {
        if (before.kind() != after.kind()) {
            throw new IllegalArgumentException("Cannot interpolate " + before.kind() + " with " + after.kind());
        }
        long span = after.videoTimestamp() - before.videoTimestamp();
        if (span <= 0 || position <= before.videoTimestamp() || position >= after.videoTimestamp()) {
            throw new IllegalArgumentException("Position " + position + " not strictly between "
                    + before.videoTimestamp() + " and " + after.videoTimestamp());
        }
        double ratio = (double) (position - before.videoTimestamp()) / span;
        SyncEvent closer = ratio >= 0.5 ? after : before;

        double confidence = lerp(before.confidence(), after.confidence(), ratio);
        EventPayload payload = interpolatePayload(before.payload(), after.payload(), closer.payload(), ratio);

        return new SyncEvent(
                syntheticId(before, after, position),
                before.kind(),
                position,
                Math.max(before.ingestTimestamp(), after.ingestTimestamp()),
                confidence,
                payload,
                false);
    }

    /** True for events produced by interpolation rather than received. */
    public static boolean isSynthetic(SyncEvent event) {
        return event.id().startsWith(SYNTHETIC_ID_PREFIX);
    }

    private static EventPayload interpolatePayload(EventPayload before, EventPayload after,
                                                   EventPayload closer, double ratio) {
        if (before instanceof FormationPayload b && after instanceof FormationPayload a) {
            FormationPayload c = (FormationPayload) closer;
            return c.withMelScores(b.melScores().interpolate(a.melScores(), ratio));
        }
        if (before instanceof MelScorePayload b && after instanceof MelScorePayload a) {
            MelScorePayload c = (MelScorePayload) closer;
            return new MelScorePayload(
                    c.formationId(),
                    lerp(b.makingScore(), a.makingScore(), ratio),
                    lerp(b.efficiencyScore(), a.efficiencyScore(), ratio),
                    lerp(b.logicalScore(), a.logicalScore(), ratio),
                    lerp(b.combinedScore(), a.combinedScore(), ratio),
                    c.stageStatus());
        }
        // triangle calls and coaching alerts carry no numeric scores
        return closer;
    }

    private static String syntheticId(SyncEvent before, SyncEvent after, long position) {
        return SYNTHETIC_ID_PREFIX + before.id() + "~" + after.id() + "@" + position;
    }

    private static double lerp(double from, double to, double ratio) {
        return from + (to - from) * ratio;
    }
}
