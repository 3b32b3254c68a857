package com.analyzemyteam.timelinesync.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(2_500_000L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(999_999L)).isZero();
    }

    @Test
    void adaptiveIntervalScalesWithRate() {
        assertThat(TimeUtils.adaptiveInterval(100, 1.0, 10, 1_000)).isEqualTo(100L);
        assertThat(TimeUtils.adaptiveInterval(100, 2.0, 10, 1_000)).isEqualTo(50L);
        assertThat(TimeUtils.adaptiveInterval(100, 0.5, 10, 1_000)).isEqualTo(200L);
    }

    @Test
    void adaptiveIntervalIsClamped() {
        assertThat(TimeUtils.adaptiveInterval(100, 50.0, 10, 1_000)).isEqualTo(10L);
        assertThat(TimeUtils.adaptiveInterval(100, 0.01, 10, 1_000)).isEqualTo(1_000L);
    }

    @Test
    void invalidRateFallsBackToBase() {
        assertThat(TimeUtils.adaptiveInterval(100, 0.0, 10, 1_000)).isEqualTo(100L);
        assertThat(TimeUtils.adaptiveInterval(100, -3.0, 10, 1_000)).isEqualTo(100L);
        assertThat(TimeUtils.adaptiveInterval(100, Double.NaN, 10, 1_000)).isEqualTo(100L);
    }

    @Test
    void floorAtZeroSaturates() {
        assertThat(TimeUtils.floorAtZero(10_000, 300_000)).isZero();
        assertThat(TimeUtils.floorAtZero(400_000, 300_000)).isEqualTo(100_000L);
    }
}
