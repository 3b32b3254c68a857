package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import com.analyzemyteam.timelinesync.service.codec.EventJsonCodec;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns push-channel JSON text ({@code {"event": <type>, "data": {...}}}) into typed messages.
 *
 * <p>Unknown message types yield empty. Structurally broken messages and messages that fail
 * event validation throw {@link InvalidEventException}; the caller drops and logs them.
 */
class RemotePushMessageParser {

    static final String FORMATION_DETECTED = "formation_detected";
    static final String COACHING_ALERT = "coaching_alert";
    static final String MEL_UPDATE = "mel_update";
    static final String MEL_PIPELINE_UPDATE = "mel_pipeline_update";
    static final String HEARTBEAT_RESPONSE = "heartbeat_response";

    static final String FORMATION_ID_PREFIX = "formation_";
    static final String ALERT_ID_PREFIX = "alert_";

    private final Clock clock;

    RemotePushMessageParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param text raw message text
     * @return typed message, or empty for unknown message types
     * @throws InvalidEventException when the message is malformed
     */
    Optional<PushMessage> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidEventException("empty push message");
        }
        JSONObject root;
        try {
            root = new JSONObject(text);
        } catch (JSONException ex) {
            throw new InvalidEventException("push message is not a JSON object", ex);
        }
        String type = root.optString("event", root.optString("type", ""));
        JSONObject data = root.optJSONObject("data");
        if (data == null) {
            data = root.optJSONObject("payload");
        }
        try {
            switch (type) {
                case FORMATION_DETECTED:
                    return Optional.of(new PushMessage.EventMessage(type, formation(require(data, type))));
                case COACHING_ALERT:
                    return Optional.of(new PushMessage.EventMessage(type, alert(require(data, type))));
                case MEL_UPDATE:
                case MEL_PIPELINE_UPDATE:
                    return Optional.of(mel(require(data, type)));
                case HEARTBEAT_RESPONSE:
                    long ts = data == null ? root.optLong("timestamp", clock.millis())
                            : data.optLong("timestamp", root.optLong("timestamp", clock.millis()));
                    return Optional.of(new PushMessage.HeartbeatAck(ts));
                default:
                    return Optional.empty();
            }
        } catch (JSONException ex) {
            throw new InvalidEventException(type + " message malformed: " + ex.getMessage(), ex);
        }
    }

    /** Message type of a raw text, best effort, for logging dropped messages. */
    static String peekType(String text) {
        try {
            JSONObject root = new JSONObject(text);
            return root.optString("event", root.optString("type", "unknown"));
        } catch (JSONException | NullPointerException ex) {
            return "unparseable";
        }
    }

    private SyncEvent formation(JSONObject data) {
        String formationId = requireString(data, "formation_id");
        FormationPayload payload = (FormationPayload) EventJsonCodec.decodePayload(EventKind.FORMATION, data);
        return SyncEvent.of(FORMATION_ID_PREFIX + formationId,
                requireTimestamp(data),
                clock.millis(),
                data.optDouble("confidence", SyncEvent.DEFAULT_CONFIDENCE),
                payload);
    }

    private SyncEvent alert(JSONObject data) {
        String alertId = requireString(data, "alert_id");
        CoachingAlertPayload payload = (CoachingAlertPayload) EventJsonCodec.decodePayload(EventKind.COACHING_ALERT, data);
        return SyncEvent.of(ALERT_ID_PREFIX + alertId,
                requireTimestamp(data),
                clock.millis(),
                data.optDouble("confidence", SyncEvent.DEFAULT_CONFIDENCE),
                payload);
    }

    private PushMessage mel(JSONObject data) {
        String formationId = requireString(data, "formation_id");
        if (data.has("stage")) {
            JSONObject metrics = data.optJSONObject("metrics");
            double score = metrics != null ? metrics.optDouble("score", Double.NaN) : data.optDouble("score", Double.NaN);
            String status = data.optString("status", "");
            if (Double.isNaN(score) && "completed".equalsIgnoreCase(status)) {
                throw new InvalidEventException("completed MEL stage without score for formation " + formationId);
            }
            return new PushMessage.MelStageMessage(formationId, data.optString("stage", ""), status, score);
        }
        MelScorePayload scores = (MelScorePayload) EventJsonCodec.decodePayload(EventKind.MEL_SCORE, data);
        long videoTs = data.optLong("video_timestamp", -1L);
        return new PushMessage.MelScoresMessage(formationId, videoTs, scores);
    }

    private static JSONObject require(JSONObject data, String type) {
        if (data == null) {
            throw new InvalidEventException(type + " message has no data object");
        }
        return data;
    }

    private static String requireString(JSONObject data, String key) {
        String v = data.optString(key, "");
        if (v.isBlank()) {
            throw new InvalidEventException(key + " is missing");
        }
        return v;
    }

    private static long requireTimestamp(JSONObject data) {
        if (!data.has("video_timestamp")) {
            throw new InvalidEventException("video_timestamp is missing");
        }
        return data.getLong("video_timestamp");
    }
}
