package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;

/**
 * Typed push-channel message produced by {@link RemotePushMessageParser}.
 */
public interface PushMessage {

    /** Wire name of the message, e.g. {@code formation_detected}. */
    String type();

    /**
     * A complete event (formation or coaching alert).
     */
    record EventMessage(String type, SyncEvent event) implements PushMessage {
    }

    /**
     * Full MEL score set for a formation.
     *
     * @param videoTimestamp position of the scores, or -1 when the backend omitted it
     */
    record MelScoresMessage(String formationId, long videoTimestamp, MelScorePayload scores) implements PushMessage {
        @Override
        public String type() {
            return RemotePushMessageParser.MEL_UPDATE;
        }
    }

    /**
     * One MEL pipeline stage report ({@code making}, {@code efficiency} or {@code logical}).
     */
    record MelStageMessage(String formationId, String stage, String status, double score) implements PushMessage {

        public boolean completed() {
            return "completed".equalsIgnoreCase(status);
        }

        @Override
        public String type() {
            return RemotePushMessageParser.MEL_PIPELINE_UPDATE;
        }
    }

    /**
     * Server acknowledgment of a heartbeat.
     */
    record HeartbeatAck(long serverTimestamp) implements PushMessage {
        @Override
        public String type() {
            return RemotePushMessageParser.HEARTBEAT_RESPONSE;
        }
    }
}
