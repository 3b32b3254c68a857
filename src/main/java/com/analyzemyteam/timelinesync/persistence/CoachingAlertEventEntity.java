package com.analyzemyteam.timelinesync.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "coaching_alert_events", indexes = {
        @Index(name = "idx_coaching_alert_video_ts", columnList = "video_timestamp"),
        @Index(name = "idx_coaching_alert_ingest_ts", columnList = "ingest_timestamp")
})
public class CoachingAlertEventEntity extends StoredEventEntity {

    protected CoachingAlertEventEntity() {}

    public CoachingAlertEventEntity(String id, long videoTimestamp, long ingestTimestamp, double confidence,
                              boolean userCreated, String payload) {
        super(id, videoTimestamp, ingestTimestamp, confidence, userCreated, payload);
    }
}
