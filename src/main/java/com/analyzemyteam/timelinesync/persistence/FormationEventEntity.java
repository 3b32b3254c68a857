package com.analyzemyteam.timelinesync.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "formation_events", indexes = {
        @Index(name = "idx_formation_video_ts", columnList = "video_timestamp"),
        @Index(name = "idx_formation_ingest_ts", columnList = "ingest_timestamp")
})
public class FormationEventEntity extends StoredEventEntity {

    protected FormationEventEntity() {}

    public FormationEventEntity(String id, long videoTimestamp, long ingestTimestamp, double confidence,
                              boolean userCreated, String payload) {
        super(id, videoTimestamp, ingestTimestamp, confidence, userCreated, payload);
    }
}
