package com.analyzemyteam.timelinesync.service.health;

import com.analyzemyteam.timelinesync.domain.ConnectionState;
import com.analyzemyteam.timelinesync.domain.ConnectionStatus;
import com.analyzemyteam.timelinesync.service.remote.RemoteSyncClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RemoteConnectionHealthIndicatorTest {

    private static Health healthFor(ConnectionStatus status) {
        RemoteSyncClient client = mock(RemoteSyncClient.class);
        when(client.isEnabled()).thenReturn(true);
        when(client.status()).thenReturn(status);
        return new RemoteConnectionHealthIndicator(client).health();
    }

    @Test
    void shouldReportUpWhenConnected() {
        Instant ack = Instant.parse("2024-05-01T12:00:00Z");

        Health health = healthFor(new ConnectionStatus(ConnectionState.CONNECTED, 0, ack));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Connected");
        assertThat(health.getDetails()).containsEntry("state", "CONNECTED");
        assertThat(health.getDetails()).containsEntry("lastHeartbeatAck", "2024-05-01T12:00:00Z");
    }

    @Test
    void shouldReportDegradedWhileReconnecting() {
        Health health = healthFor(new ConnectionStatus(ConnectionState.DISCONNECTED, 3, null));

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Reconnecting");
        assertThat(health.getDetails()).containsEntry("reconnectAttempts", 3);
        assertThat(health.getDetails()).doesNotContainKey("lastHeartbeatAck");
    }

    @Test
    void shouldReportDownWhenReconnectBudgetExhausted() {
        Health health = healthFor(new ConnectionStatus(ConnectionState.DEGRADED, 10, null));

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Reconnect attempts exhausted");
    }

    @Test
    void shouldReportUpWhenRemoteSyncDisabled() {
        RemoteSyncClient client = mock(RemoteSyncClient.class);
        when(client.isEnabled()).thenReturn(false);

        Health health = new RemoteConnectionHealthIndicator(client).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Remote sync disabled");
    }
}
