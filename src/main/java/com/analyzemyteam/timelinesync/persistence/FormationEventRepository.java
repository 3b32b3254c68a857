package com.analyzemyteam.timelinesync.persistence;

public interface FormationEventRepository extends StoredEventRepository<FormationEventEntity> {
}
