package com.analyzemyteam.timelinesync.persistence;

public interface CoachingAlertEventRepository extends StoredEventRepository<CoachingAlertEventEntity> {
}
