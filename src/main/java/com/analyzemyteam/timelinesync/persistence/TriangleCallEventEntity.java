package com.analyzemyteam.timelinesync.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "triangle_call_events", indexes = {
        @Index(name = "idx_triangle_call_video_ts", columnList = "video_timestamp"),
        @Index(name = "idx_triangle_call_ingest_ts", columnList = "ingest_timestamp")
})
public class TriangleCallEventEntity extends StoredEventEntity {

    protected TriangleCallEventEntity() {}

    public TriangleCallEventEntity(String id, long videoTimestamp, long ingestTimestamp, double confidence,
                              boolean userCreated, String payload) {
        super(id, videoTimestamp, ingestTimestamp, confidence, userCreated, payload);
    }
}
