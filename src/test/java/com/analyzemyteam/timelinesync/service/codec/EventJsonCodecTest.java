package com.analyzemyteam.timelinesync.service.codec;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.MelScorePayload;
import com.analyzemyteam.timelinesync.domain.MelScores;
import com.analyzemyteam.timelinesync.domain.PlayerPosition;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.domain.TriangleCallType;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventJsonCodecTest {

    @Test
    void decodesBackendFormationRow() {
        String json = """
                {"id": "f-42", "kind": "formation", "video_timestamp": 65000, "ingest_timestamp": 1700000000000,
                 "confidence": 0.91,
                 "payload": {"formation_type": "larry", "triangle_call": "strong_side", "hash_position": "L",
                             "field_zone": "Red Zone",
                             "player_positions": [{"player_id": "qb", "role": "QB", "x": 10.5, "y": 20}],
                             "mel_results": {"making_score": 90, "efficiency_score": 80, "logical_score": 70}}}
                """;

        SyncEvent event = EventJsonCodec.decodeEvent(new JSONObject(json), 0L);

        assertThat(event.kind()).isEqualTo(EventKind.FORMATION);
        assertThat(event.videoTimestamp()).isEqualTo(65_000L);
        assertThat(event.ingestTimestamp()).isEqualTo(1_700_000_000_000L);
        FormationPayload payload = event.payloadAs(FormationPayload.class);
        assertThat(payload.formationType()).isEqualTo(FormationType.LARRY);
        assertThat(payload.recommendedCall()).isEqualTo(TriangleCallType.STRONG_SIDE);
        assertThat(payload.playerPositions()).containsExactly(new PlayerPosition("qb", "QB", 10.5, 20.0));
        // combined defaults to the stage mean
        assertThat(payload.melScores().combined()).isEqualTo(80.0);
    }

    @Test
    void missingIngestTimestampUsesDefault() {
        JSONObject json = new JSONObject()
                .put("id", "a1").put("kind", "coaching_alert").put("video_timestamp", 10)
                .put("payload", new JSONObject().put("alert_type", "blitz").put("priority_level", 4));

        SyncEvent event = EventJsonCodec.decodeEvent(json, 777L);

        assertThat(event.ingestTimestamp()).isEqualTo(777L);
        assertThat(event.confidence()).isEqualTo(SyncEvent.DEFAULT_CONFIDENCE);
        assertThat(event.payloadAs(CoachingAlertPayload.class).priorityLevel()).isEqualTo(4);
    }

    @Test
    void rejectsUnknownKind() {
        JSONObject json = new JSONObject().put("id", "x").put("kind", "weather")
                .put("video_timestamp", 0).put("payload", new JSONObject());

        assertThatThrownBy(() -> EventJsonCodec.decodeEvent(json, 0L))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("unknown kind");
    }

    @Test
    void rejectsMissingTimestampAndPayload() {
        JSONObject noTs = new JSONObject().put("id", "x").put("kind", "formation").put("payload", new JSONObject());
        JSONObject noPayload = new JSONObject().put("id", "x").put("kind", "formation").put("video_timestamp", 5);

        assertThatThrownBy(() -> EventJsonCodec.decodeEvent(noTs, 0L)).isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> EventJsonCodec.decodeEvent(noPayload, 0L)).isInstanceOf(InvalidEventException.class);
    }

    @Test
    void wrapsTypeErrorsAsInvalidEvent() {
        JSONObject json = new JSONObject().put("id", "x").put("kind", "formation")
                .put("video_timestamp", "soon").put("payload", new JSONObject());

        assertThatThrownBy(() -> EventJsonCodec.decodeEvent(json, 0L))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void negativeTimestampFailsValidation() {
        JSONObject json = new JSONObject().put("id", "x").put("kind", "mel_score")
                .put("video_timestamp", -5).put("payload", new JSONObject());

        assertThatThrownBy(() -> EventJsonCodec.decodeEvent(json, 0L)).isInstanceOf(InvalidEventException.class);
    }

    @Test
    void encodedEventDecodesToSameContent() {
        SyncEvent original = SyncEvent.userCreated("m1", 1_000, 5, 0.75, new FormationPayload(
                FormationType.RICKY, TriangleCallType.WEAK_SIDE, "M", "Midfield",
                List.of(new PlayerPosition("wr1", "WR", 1, 2)), MelScores.ofStages(70, 80, 90)));

        SyncEvent decoded = EventJsonCodec.decodeEvent(EventJsonCodec.encodeEvent(original), 0L);

        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void melPayloadKeepsExplicitCombinedScore() {
        MelScorePayload payload = (MelScorePayload) EventJsonCodec.decodePayload(EventKind.MEL_SCORE,
                new JSONObject().put("formation_id", "f1").put("making_score", 10).put("combined_score", 99));

        assertThat(payload.combinedScore()).isEqualTo(99.0);
        assertThat(payload.formationId()).isEqualTo("f1");
    }
}
