package com.analyzemyteam.timelinesync.service.codec;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.EventPayload;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.MelScores;
import com.analyzemyteam.timelinesync.domain.PlayerPosition;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallPayload;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for events and payloads, shared by the local store, the REST fetch parser and
 * the push message parser. Field names are lower snake case.
 *
 * <p>Decoding is strict about structure (kind, timestamp, payload object) and lenient about
 * optional fields, which take documented defaults.
 */
public final class EventJsonCodec {

    private EventJsonCodec() {}

    /**
     * Encodes a full event in wire form.
     */
    public static JSONObject encodeEvent(SyncEvent event) {
        JSONObject json = new JSONObject();
        json.put("id", event.id());
        json.put("kind", event.kind().wireName());
        json.put("video_timestamp", event.videoTimestamp());
        json.put("ingest_timestamp", event.ingestTimestamp());
        json.put("confidence", event.confidence());
        json.put("user_created", event.userCreated());
        json.put("payload", encodePayload(event.payload()));
        return json;
    }

    /**
     * Decodes a wire-form event.
     *
     * @param json            event object
     * @param defaultIngestMs ingest time used when the object carries none
     * @return validated event
     * @throws InvalidEventException when the object is malformed or fails validation
     */
    public static SyncEvent decodeEvent(JSONObject json, long defaultIngestMs) {
        if (json == null) {
            throw new InvalidEventException("event object is missing");
        }
        try {
            String id = json.optString("id", "");
            EventKind kind = EventKind.fromWire(json.optString("kind", null))
                    .orElseThrow(() -> new InvalidEventException(id, "unknown kind: " + json.opt("kind")));
            if (!json.has("video_timestamp")) {
                throw new InvalidEventException(id, "video_timestamp is missing");
            }
            long videoTs = json.getLong("video_timestamp");
            long ingestTs = json.optLong("ingest_timestamp", defaultIngestMs);
            double confidence = json.optDouble("confidence", SyncEvent.DEFAULT_CONFIDENCE);
            JSONObject payloadJson = json.optJSONObject("payload");
            if (payloadJson == null) {
                throw new InvalidEventException(id, "payload object is missing");
            }
            EventPayload payload = decodePayload(kind, payloadJson);
            return new SyncEvent(id, kind, videoTs, ingestTs, confidence, payload,
                    json.optBoolean("user_created", false));
        } catch (JSONException ex) {
            throw new InvalidEventException("malformed event: " + ex.getMessage(), ex);
        }
    }

    public static JSONObject encodePayload(EventPayload payload) {
        JSONObject json = new JSONObject();
        if (payload instanceof FormationPayload f) {
            json.put("formation_type", f.formationType().wireName());
            json.put("recommended_call", f.recommendedCall().wireName());
            json.put("hash_position", f.hashPosition());
            json.put("field_zone", f.fieldZone());
            JSONArray players = new JSONArray();
            for (PlayerPosition p : f.playerPositions()) {
                players.put(new JSONObject()
                        .put("player_id", p.playerId())
                        .put("role", p.role())
                        .put("x", p.x())
                        .put("y", p.y()));
            }
            json.put("player_positions", players);
            json.put("mel_results", encodeMel(f.melScores()));
        } else if (payload instanceof TriangleCallPayload t) {
            json.put("call", t.call().wireName());
            json.put("formation_id", t.formationId());
            json.put("reason", t.reason());
        } else if (payload instanceof CoachingAlertPayload a) {
            json.put("alert_type", a.alertType());
            json.put("message", a.message());
            json.put("target_staff", new JSONArray(a.targetStaff()));
            json.put("priority_level", a.priorityLevel());
            json.put("acknowledged", a.acknowledged());
        } else if (payload instanceof MelScorePayload m) {
            json.put("formation_id", m.formationId());
            json.put("making_score", m.makingScore());
            json.put("efficiency_score", m.efficiencyScore());
            json.put("logical_score", m.logicalScore());
            json.put("combined_score", m.combinedScore());
            json.put("stage_status", m.stageStatus());
        } else {
            throw new IllegalArgumentException("Unsupported payload " + payload.getClass().getName());
        }
        return json;
    }

    /**
     * Decodes a payload for a known kind.
     *
     * @throws InvalidEventException when a field has the wrong type
     */
    public static EventPayload decodePayload(EventKind kind, JSONObject json) {
        try {
            return switch (kind) {
                case FORMATION -> new FormationPayload(
                        FormationType.fromWire(json.optString("formation_type", null)),
                        TriangleCallType.fromWire(firstNonBlank(json, "recommended_call", "triangle_call")),
                        json.optString("hash_position", ""),
                        json.optString("field_zone", ""),
                        decodePlayers(json.optJSONArray("player_positions")),
                        decodeMel(json.optJSONObject("mel_results")));
                case TRIANGLE_CALL -> new TriangleCallPayload(
                        TriangleCallType.fromWire(json.optString("call", null)),
                        json.optString("formation_id", ""),
                        json.optString("reason", ""));
                case COACHING_ALERT -> new CoachingAlertPayload(
                        json.optString("alert_type", ""),
                        json.optString("message", ""),
                        decodeStrings(json.optJSONArray("target_staff")),
                        json.optInt("priority_level", CoachingAlertPayload.MIN_PRIORITY),
                        json.optBoolean("acknowledged", false));
                case MEL_SCORE -> decodeMelPayload(json);
            };
        } catch (JSONException ex) {
            throw new InvalidEventException("malformed " + kind.wireName() + " payload: " + ex.getMessage(), ex);
        }
    }

    private static MelScorePayload decodeMelPayload(JSONObject json) {
        double making = json.optDouble("making_score", 0.0);
        double efficiency = json.optDouble("efficiency_score", 0.0);
        double logical = json.optDouble("logical_score", 0.0);
        double combined = json.has("combined_score")
                ? json.getDouble("combined_score")
                : (making + efficiency + logical) / 3.0;
        return new MelScorePayload(json.optString("formation_id", ""), making, efficiency, logical, combined,
                json.optString("stage_status", ""));
    }

    static JSONObject encodeMel(MelScores scores) {
        return new JSONObject()
                .put("making_score", scores.making())
                .put("efficiency_score", scores.efficiency())
                .put("logical_score", scores.logical())
                .put("combined_score", scores.combined());
    }

    static MelScores decodeMel(JSONObject json) {
        if (json == null) {
            return MelScores.EMPTY;
        }
        double making = json.optDouble("making_score", 0.0);
        double efficiency = json.optDouble("efficiency_score", 0.0);
        double logical = json.optDouble("logical_score", 0.0);
        if (json.has("combined_score")) {
            return new MelScores(making, efficiency, logical, json.getDouble("combined_score"));
        }
        return MelScores.ofStages(making, efficiency, logical);
    }

    private static List<PlayerPosition> decodePlayers(JSONArray array) {
        List<PlayerPosition> players = new ArrayList<>();
        if (array == null) {
            return players;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject p = array.optJSONObject(i);
            if (p != null) {
                players.add(new PlayerPosition(
                        p.optString("player_id", ""),
                        p.optString("role", ""),
                        p.optDouble("x", 0.0),
                        p.optDouble("y", 0.0)));
            }
        }
        return players;
    }

    private static List<String> decodeStrings(JSONArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.length(); i++) {
            String v = array.optString(i, "");
            if (!v.isBlank()) {
                values.add(v);
            }
        }
        return values;
    }

    private static String firstNonBlank(JSONObject json, String... keys) {
        for (String key : keys) {
            String v = json.optString(key, "");
            if (!v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
