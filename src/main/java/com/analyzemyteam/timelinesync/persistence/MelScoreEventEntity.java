package com.analyzemyteam.timelinesync.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "mel_score_events", indexes = {
        @Index(name = "idx_mel_score_video_ts", columnList = "video_timestamp"),
        @Index(name = "idx_mel_score_ingest_ts", columnList = "ingest_timestamp")
})
public class MelScoreEventEntity extends StoredEventEntity {

    protected MelScoreEventEntity() {}

    public MelScoreEventEntity(String id, long videoTimestamp, long ingestTimestamp, double confidence,
                              boolean userCreated, String payload) {
        super(id, videoTimestamp, ingestTimestamp, confidence, userCreated, payload);
    }
}
