package com.analyzemyteam.timelinesync.persistence;

public interface MelScoreEventRepository extends StoredEventRepository<MelScoreEventEntity> {
}
