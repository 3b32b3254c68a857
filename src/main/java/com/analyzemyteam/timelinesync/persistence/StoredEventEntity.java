package com.analyzemyteam.timelinesync.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.MappedSuperclass;

/**
 * Columns shared by every per-kind event table. The payload is stored as JSON text.
 */
@MappedSuperclass
public abstract class StoredEventEntity {

    @Id
    @Column(name = "id", length = 200, nullable = false)
    private String id;

    @Column(name = "video_timestamp", nullable = false)
    private long videoTimestamp;

    @Column(name = "ingest_timestamp", nullable = false)
    private long ingestTimestamp;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "user_created", nullable = false)
    private boolean userCreated;

    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    protected StoredEventEntity() {}

    protected StoredEventEntity(String id, long videoTimestamp, long ingestTimestamp, double confidence,
                                boolean userCreated, String payload) {
        this.id = id;
        this.videoTimestamp = videoTimestamp;
        this.ingestTimestamp = ingestTimestamp;
        this.confidence = confidence;
        this.userCreated = userCreated;
        this.payload = payload;
    }

    public String getId() { return id; }
    public long getVideoTimestamp() { return videoTimestamp; }
    public long getIngestTimestamp() { return ingestTimestamp; }
    public double getConfidence() { return confidence; }
    public boolean isUserCreated() { return userCreated; }
    public String getPayload() { return payload; }
}
