package com.analyzemyteam.timelinesync.persistence;

public interface TriangleCallEventRepository extends StoredEventRepository<TriangleCallEventEntity> {
}
