package com.analyzemyteam.timelinesync.service.coordinator.event;

import com.analyzemyteam.timelinesync.domain.SyncStatistics;

import java.time.Instant;

public record StatisticsUpdatedEvent(SyncStatistics statistics, int queueDepth, Instant at) {
    public StatisticsUpdatedEvent {
        at = at == null ? Instant.now() : at;
    }
}
