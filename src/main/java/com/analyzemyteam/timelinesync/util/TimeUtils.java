package com.analyzemyteam.timelinesync.util;

/**
 * Utility methods for time conversions and timeline arithmetic.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    public static final long MILLIS_PER_HOUR = 3_600_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Adaptive tick interval for a playback rate: {@code base / rate}, clamped to [min, max].
     * Non-positive or NaN rates fall back to the base interval.
     *
     * @param baseMs interval at 1x playback
     * @param rate   playback rate multiplier
     * @param minMs  lower clamp
     * @param maxMs  upper clamp
     * @return interval in milliseconds
     */
    public static long adaptiveInterval(long baseMs, double rate, long minMs, long maxMs) {
        double effectiveRate = (Double.isNaN(rate) || rate <= 0.0) ? 1.0 : rate;
        long interval = Math.round(baseMs / effectiveRate);
        return Math.max(minMs, Math.min(maxMs, interval));
    }

    /** Saturating subtraction that never goes below zero (timeline positions are non-negative). */
    public static long floorAtZero(long value, long minus) {
        return Math.max(0L, value - minus);
    }
}
