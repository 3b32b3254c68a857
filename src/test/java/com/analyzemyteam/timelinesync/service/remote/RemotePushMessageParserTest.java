package com.analyzemyteam.timelinesync.service.remote;

import com.analyzemyteam.timelinesync.domain.CoachingAlertPayload;
import com.analyzemyteam.timelinesync.domain.EventKind;
import com.analyzemyteam.timelinesync.domain.FormationPayload;
import com.analyzemyteam.timelinesync.domain.FormationType;
import com.analyzemyteam.timelinesync.domain.SyncEvent;
import com.analyzemyteam.timelinesync.exception.InvalidEventException;
import com.analyzemyteam.timelinesync.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemotePushMessageParserTest {

    private final RemotePushMessageParser parser = new RemotePushMessageParser(new MutableClock(5_000L));

    @Test
    void parsesFormationDetected() {
        String text = """
                {"event": "formation_detected",
                 "data": {"formation_id": "77", "video_timestamp": 12000, "confidence": 0.9,
                          "formation_type": "linda", "hash_position": "R"}}
                """;

        PushMessage message = parser.parse(text).orElseThrow();

        assertThat(message).isInstanceOf(PushMessage.EventMessage.class);
        SyncEvent event = ((PushMessage.EventMessage) message).event();
        assertThat(event.id()).isEqualTo("formation_77");
        assertThat(event.kind()).isEqualTo(EventKind.FORMATION);
        assertThat(event.ingestTimestamp()).isEqualTo(5_000L);
        assertThat(event.payloadAs(FormationPayload.class).formationType()).isEqualTo(FormationType.LINDA);
    }

    @Test
    void parsesCoachingAlertWithTypeAndPayloadKeys() {
        String text = """
                {"type": "coaching_alert",
                 "payload": {"alert_id": "9", "video_timestamp": 500, "alert_type": "blitz",
                             "message": "Blitz incoming", "priority_level": 5, "target_staff": ["dc", "lb"]}}
                """;

        SyncEvent event = ((PushMessage.EventMessage) parser.parse(text).orElseThrow()).event();

        assertThat(event.id()).isEqualTo("alert_9");
        CoachingAlertPayload payload = event.payloadAs(CoachingAlertPayload.class);
        assertThat(payload.priorityLevel()).isEqualTo(5);
        assertThat(payload.targetStaff()).containsExactly("dc", "lb");
    }

    @Test
    void parsesMelStageUpdate() {
        String text = """
                {"event": "mel_pipeline_update",
                 "data": {"formation_id": "77", "stage": "making", "status": "completed", "metrics": {"score": 88.5}}}
                """;

        PushMessage.MelStageMessage stage = (PushMessage.MelStageMessage) parser.parse(text).orElseThrow();

        assertThat(stage.formationId()).isEqualTo("77");
        assertThat(stage.stage()).isEqualTo("making");
        assertThat(stage.score()).isEqualTo(88.5);
        assertThat(stage.completed()).isTrue();
    }

    @Test
    void parsesFullMelScores() {
        String text = """
                {"event": "mel_update",
                 "data": {"formation_id": "77", "making_score": 90, "efficiency_score": 60, "logical_score": 30}}
                """;

        PushMessage.MelScoresMessage scores = (PushMessage.MelScoresMessage) parser.parse(text).orElseThrow();

        assertThat(scores.videoTimestamp()).isEqualTo(-1L);
        assertThat(scores.scores().combinedScore()).isEqualTo(60.0);
    }

    @Test
    void parsesHeartbeatResponse() {
        PushMessage message = parser.parse("{\"event\":\"heartbeat_response\",\"timestamp\":42}").orElseThrow();

        assertThat(message).isEqualTo(new PushMessage.HeartbeatAck(42L));
    }

    @Test
    void unknownTypeIsIgnored() {
        assertThat(parser.parse("{\"event\":\"presence\",\"data\":{}}")).isEmpty();
    }

    @Test
    void malformedMessagesAreRejected() {
        assertThatThrownBy(() -> parser.parse("not json")).isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> parser.parse(" ")).isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> parser.parse("{\"event\":\"formation_detected\"}"))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("no data");
        assertThatThrownBy(() -> parser.parse(
                "{\"event\":\"formation_detected\",\"data\":{\"formation_id\":\"1\"}}"))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("video_timestamp");
        assertThatThrownBy(() -> parser.parse(
                "{\"event\":\"mel_update\",\"data\":{\"formation_id\":\"1\",\"stage\":\"logical\",\"status\":\"completed\"}}"))
                .isInstanceOf(InvalidEventException.class);
    }

    @Test
    void peekTypeIsBestEffort() {
        assertThat(RemotePushMessageParser.peekType("{\"event\":\"coaching_alert\"}")).isEqualTo("coaching_alert");
        assertThat(RemotePushMessageParser.peekType("{}")).isEqualTo("unknown");
        assertThat(RemotePushMessageParser.peekType("<html>")).isEqualTo("unparseable");
    }
}
