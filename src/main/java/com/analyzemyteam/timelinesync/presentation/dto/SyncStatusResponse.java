package com.analyzemyteam.timelinesync.presentation.dto;

import com.analyzemyteam.timelinesync.domain.ConnectionStatus;
import com.analyzemyteam.timelinesync.domain.SyncStatistics;

/**
 * Snapshot of the synchronization engine for dashboards.
 */
public record SyncStatusResponse(
        boolean remoteEnabled,
        ConnectionStatus connection,
        SyncStatistics statistics,
        double cacheHitRatio,
        long videoPosition,
        boolean playing,
        double playbackRate,
        long tickIntervalMs,
        int queueDepth,
        int cachedEvents,
        int markers
) {
}
